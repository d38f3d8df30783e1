package io.relayhive.core.consumer;

import io.relayhive.core.RelayException;

/**
 * Raised when a worker cannot open its channel or subscribe to its queue.
 */
public class ConsumerStartException extends RelayException {

    public ConsumerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
