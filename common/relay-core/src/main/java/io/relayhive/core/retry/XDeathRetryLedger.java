package io.relayhive.core.retry;

import io.relayhive.core.message.DeathRecord;
import io.relayhive.core.message.InboundMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts attempts from RabbitMQ's {@code x-death} header.
 * <p>
 * Only {@code rejected} records count. When several queues rejected the message, the record of
 * the queue being consumed wins; otherwise the first rejected record in broker order is used.
 * The result is that record's count plus one, or zero when the message was never rejected.
 */
public final class XDeathRetryLedger implements RetryLedger {

    private static final Logger log = LoggerFactory.getLogger(XDeathRetryLedger.class);

    @Override
    public int attempts(InboundMessage message) {
        List<DeathRecord> rejected = message.deathHistory().stream()
            .filter(DeathRecord::isRejected)
            .toList();
        if (rejected.isEmpty()) {
            return 0;
        }
        DeathRecord record = rejected.stream()
            .filter(r -> message.queue().equals(r.queue()))
            .findFirst()
            .orElseGet(() -> {
                if (rejected.size() > 1) {
                    log.debug("no rejected x-death record for queue={}, using first of {} records",
                        message.queue(), rejected.size());
                }
                return rejected.get(0);
            });
        return (int) Math.min(Integer.MAX_VALUE, record.count() + 1);
    }
}
