package io.relayhive.core.message;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single delivery together with the channel it arrived on.
 * <p>
 * The delivery is settled (acknowledged, negatively acknowledged or rejected) at most once.
 * Later settle calls are ignored and report {@code false}.
 */
public final class InboundMessage {

    private static final Logger log = LoggerFactory.getLogger(InboundMessage.class);

    private final Channel channel;
    private final String queue;
    private final long deliveryTag;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private List<DeathRecord> deathHistory;

    public InboundMessage(Channel channel,
                          String queue,
                          long deliveryTag,
                          String exchange,
                          String routingKey,
                          boolean redelivered,
                          AMQP.BasicProperties properties,
                          byte[] body) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.deliveryTag = deliveryTag;
        this.exchange = exchange == null ? "" : exchange;
        this.routingKey = routingKey == null ? "" : routingKey;
        this.redelivered = redelivered;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.body = body == null ? new byte[0] : body;
    }

    public String queue() {
        return queue;
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    public boolean redelivered() {
        return redelivered;
    }

    public AMQP.BasicProperties properties() {
        return properties;
    }

    public Map<String, Object> headers() {
        Map<String, Object> headers = properties.getHeaders();
        return headers == null ? Map.of() : headers;
    }

    public String messageId() {
        return properties.getMessageId();
    }

    public String correlationId() {
        return properties.getCorrelationId();
    }

    public byte[] body() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public List<DeathRecord> deathHistory() {
        if (deathHistory == null) {
            deathHistory = DeathRecord.fromHeaders(properties.getHeaders());
        }
        return deathHistory;
    }

    public boolean isSettled() {
        return settled.get();
    }

    public boolean ack() {
        if (!markSettled("ack")) {
            return false;
        }
        try {
            channel.basicAck(deliveryTag, false);
            return true;
        } catch (IOException | RuntimeException ex) {
            throw new MessageSettlementException("Failed to ack delivery " + deliveryTag + " on queue " + queue, ex);
        }
    }

    public boolean nack(boolean requeue) {
        if (!markSettled("nack")) {
            return false;
        }
        try {
            channel.basicNack(deliveryTag, false, requeue);
            return true;
        } catch (IOException | RuntimeException ex) {
            throw new MessageSettlementException("Failed to nack delivery " + deliveryTag + " on queue " + queue, ex);
        }
    }

    public boolean reject(boolean requeue) {
        if (!markSettled("reject")) {
            return false;
        }
        try {
            channel.basicReject(deliveryTag, requeue);
            return true;
        } catch (IOException | RuntimeException ex) {
            throw new MessageSettlementException("Failed to reject delivery " + deliveryTag + " on queue " + queue, ex);
        }
    }

    /**
     * Publishes the original body and properties, headers included, on this delivery's channel.
     * Does not settle the delivery.
     */
    public void republish(String targetExchange, String targetRoutingKey) {
        Objects.requireNonNull(targetExchange, "targetExchange");
        Objects.requireNonNull(targetRoutingKey, "targetRoutingKey");
        try {
            channel.basicPublish(targetExchange, targetRoutingKey, properties, body);
        } catch (IOException | RuntimeException ex) {
            throw new MessageSettlementException("Failed to republish delivery " + deliveryTag
                + " from queue " + queue + " to exchange " + targetExchange + " with routing key "
                + targetRoutingKey, ex);
        }
    }

    private boolean markSettled(String action) {
        if (settled.compareAndSet(false, true)) {
            return true;
        }
        log.warn("{} ignored, delivery already settled queue={} deliveryTag={}", action, queue, deliveryTag);
        return false;
    }

    @Override
    public String toString() {
        return "InboundMessage{queue='" + queue + "', deliveryTag=" + deliveryTag
            + ", routingKey='" + routingKey + "', messageId='" + messageId() + "', redelivered=" + redelivered + '}';
    }
}
