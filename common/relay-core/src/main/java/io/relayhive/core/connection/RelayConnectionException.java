package io.relayhive.core.connection;

import io.relayhive.core.RelayException;

/**
 * Raised when no broker connection could be established or when the client is used before
 * it was started.
 */
public class RelayConnectionException extends RelayException {

    private final int attempts;

    public RelayConnectionException(String message) {
        super(message);
        this.attempts = 0;
    }

    public RelayConnectionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Number of connection attempts made before giving up; {@code 0} when no attempt was made.
     */
    public int attempts() {
        return attempts;
    }
}
