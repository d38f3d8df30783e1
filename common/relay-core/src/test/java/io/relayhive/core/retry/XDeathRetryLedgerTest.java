package io.relayhive.core.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.rabbitmq.client.Channel;
import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.testing.Deliveries;
import java.util.Map;
import org.junit.jupiter.api.Test;

class XDeathRetryLedgerTest {

    private final RetryLedger ledger = new XDeathRetryLedger();
    private final Channel channel = mock(Channel.class);

    @Test
    void firstDeliveryHasZeroAttempts() {
        assertThat(ledger.attempts(delivery())).isZero();
    }

    @Test
    void rejectedCountPlusOne() {
        assertThat(ledger.attempts(delivery(Deliveries.death("billing", "rejected", 0L)))).isEqualTo(1);
        assertThat(ledger.attempts(delivery(Deliveries.death("billing", "rejected", 2L)))).isEqualTo(3);
    }

    @Test
    void ignoresRecordsThatAreNotRejections() {
        int attempts = ledger.attempts(delivery(
            Deliveries.death("relayhive.retry.billing", "expired", 5L),
            Deliveries.death("billing", "rejected", 1L)));

        assertThat(attempts).isEqualTo(2);
        assertThat(ledger.attempts(delivery(Deliveries.death("relayhive.retry.billing", "expired", 5L)))).isZero();
    }

    @Test
    void prefersRejectionFromConsumedQueue() {
        int attempts = ledger.attempts(delivery(
            Deliveries.death("shipping", "rejected", 4L),
            Deliveries.death("billing", "rejected", 1L)));

        assertThat(attempts).isEqualTo(2);
    }

    @Test
    void fallsBackToFirstRejectionWhenConsumedQueueIsAbsent() {
        int attempts = ledger.attempts(delivery(
            Deliveries.death("shipping", "rejected", 4L),
            Deliveries.death("audit", "rejected", 1L)));

        assertThat(attempts).isEqualTo(5);
    }

    @SafeVarargs
    private InboundMessage delivery(Map<String, Object>... deaths) {
        return Deliveries.message(channel, "billing", "{}", Deliveries.propertiesWithDeaths("m-1", deaths));
    }
}
