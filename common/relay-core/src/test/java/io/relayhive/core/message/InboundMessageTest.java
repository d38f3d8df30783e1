package io.relayhive.core.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.relayhive.core.testing.Deliveries;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class InboundMessageTest {

    private final Channel channel = mock(Channel.class);

    @Test
    void settlesAtMostOnce() throws Exception {
        InboundMessage message = Deliveries.message(channel, "billing", "{}", Deliveries.propertiesWithDeaths("m-1"));

        assertThat(message.ack()).isTrue();
        assertThat(message.nack(false)).isFalse();
        assertThat(message.ack()).isFalse();

        verify(channel, times(1)).basicAck(Deliveries.DELIVERY_TAG, false);
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
        assertThat(message.isSettled()).isTrue();
    }

    @Test
    void nackDoesNotRequeueWhenAskedNotTo() throws Exception {
        InboundMessage message = Deliveries.message(channel, "billing", "{}", Deliveries.propertiesWithDeaths("m-1"));

        message.nack(false);

        verify(channel).basicNack(Deliveries.DELIVERY_TAG, false, false);
    }

    @Test
    void republishSendsOriginalBodyAndProperties() throws Exception {
        AMQP.BasicProperties properties = Deliveries.propertiesWithDeaths("m-1", Deliveries.death("billing", "rejected", 0L));
        InboundMessage message = Deliveries.message(channel, "billing", "{\"a\":1}", properties);

        message.republish("relayhive.dead-letter", "relayhive.dlq.billing");

        verify(channel).basicPublish("relayhive.dead-letter", "relayhive.dlq.billing", properties,
            "{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        assertThat(message.isSettled()).isFalse();
    }

    @Test
    void channelFailureIsWrappedWithDeliveryContext() throws Exception {
        doThrow(new IOException("channel closed")).when(channel).basicAck(anyLong(), anyBoolean());
        InboundMessage message = Deliveries.message(channel, "billing", "{}", Deliveries.propertiesWithDeaths("m-1"));

        assertThatThrownBy(message::ack)
            .isInstanceOf(MessageSettlementException.class)
            .hasMessageContaining("billing")
            .hasMessageContaining(String.valueOf(Deliveries.DELIVERY_TAG))
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void missingEnvelopeFieldsDefaultToEmpty() {
        InboundMessage message = new InboundMessage(channel, "billing", 7L, null, null, true, null, null);

        assertThat(message.exchange()).isEmpty();
        assertThat(message.routingKey()).isEmpty();
        assertThat(message.redelivered()).isTrue();
        assertThat(message.body()).isEmpty();
        assertThat(message.headers()).isEmpty();
        assertThat(message.deathHistory()).isEmpty();
        assertThat(message.messageId()).isNull();
    }
}
