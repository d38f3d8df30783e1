package io.relayhive.core.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.relayhive.core.message.Envelope;
import io.relayhive.core.message.EnvelopeCodec;
import io.relayhive.core.message.EnvelopeMeta;
import io.relayhive.core.topology.TopologyNames;
import java.time.Clock;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * Publishes persistent JSON envelopes through a {@link RabbitTemplate}.
 * <p>
 * {@code publishedAt} never decreases across calls on one instance, even if the clock steps
 * backwards. Message id and correlation id carry the envelope id. Payloads must serialise to a
 * JSON object.
 */
public final class RabbitEnvelopePublisher implements EnvelopePublisher {

    private final RabbitTemplate rabbitTemplate;
    private final EnvelopeCodec codec;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final AtomicLong lastPublishedAt = new AtomicLong(Long.MIN_VALUE);

    public RabbitEnvelopePublisher(RabbitTemplate rabbitTemplate, EnvelopeCodec codec) {
        this(rabbitTemplate, codec, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public RabbitEnvelopePublisher(RabbitTemplate rabbitTemplate,
                                   EnvelopeCodec codec,
                                   Clock clock,
                                   Supplier<String> idGenerator) {
        this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    @Override
    public <T> Envelope<T> publish(String topic, T payload) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        Objects.requireNonNull(payload, "payload");
        requireObjectPayload(topic, payload);
        Envelope<T> envelope = new Envelope<>(payload, new EnvelopeMeta(idGenerator.get(), nextPublishedAt()));
        byte[] body;
        try {
            body = codec.encode(envelope);
        } catch (JsonProcessingException ex) {
            throw new PublishException(topic, "Failed to serialise envelope " + envelope.meta().id()
                + " for topic " + topic, ex);
        }
        MessageProperties props = new MessageProperties();
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding("UTF-8");
        props.setContentLength(body.length);
        props.setMessageId(envelope.meta().id());
        props.setCorrelationId(envelope.meta().id());
        props.setTimestamp(new Date(envelope.meta().publishedAt()));
        try {
            rabbitTemplate.send(TopologyNames.ROUTER_EXCHANGE, topic, new Message(body, props));
        } catch (AmqpException ex) {
            throw new PublishException(topic, "Failed to publish envelope " + envelope.meta().id()
                + " to exchange " + TopologyNames.ROUTER_EXCHANGE + " with routing key " + topic, ex);
        }
        return envelope;
    }

    private void requireObjectPayload(String topic, Object payload) {
        JsonNode tree;
        try {
            tree = codec.objectMapper().valueToTree(payload);
        } catch (IllegalArgumentException ex) {
            throw new PublishException(topic, "Failed to serialise payload of type "
                + payload.getClass().getName() + " for topic " + topic, ex);
        }
        if (!tree.isObject()) {
            throw new PublishException(topic, "Payload for topic " + topic + " must serialise to a JSON object but was "
                + tree.getNodeType().name().toLowerCase(Locale.ROOT), null);
        }
    }

    private long nextPublishedAt() {
        long now = clock.millis();
        return lastPublishedAt.accumulateAndGet(now, Math::max);
    }
}
