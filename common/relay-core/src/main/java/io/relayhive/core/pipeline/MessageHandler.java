package io.relayhive.core.pipeline;

import io.relayhive.core.message.Envelope;

/**
 * User callback for one decoded message. Returning normally acknowledges the delivery; throwing
 * sends it through the retry cycle.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(Envelope<T> envelope) throws Exception;
}
