package io.relayhive.core.publisher;

import io.relayhive.core.message.Envelope;

/**
 * Publishes payloads wrapped in an {@link Envelope} to the router exchange.
 */
public interface EnvelopePublisher {

    /**
     * Wraps {@code payload} in a fresh envelope and publishes it with routing key {@code topic}.
     *
     * @return the envelope that was sent
     * @throws PublishException when serialisation or the publish call fails
     */
    <T> Envelope<T> publish(String topic, T payload);
}
