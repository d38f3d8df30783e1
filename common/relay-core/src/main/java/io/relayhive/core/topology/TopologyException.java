package io.relayhive.core.topology;

import io.relayhive.core.RelayException;

/**
 * Raised when the queues, exchanges or bindings of a processor cannot be asserted.
 */
public class TopologyException extends RelayException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
