package io.relayhive.core;

/**
 * Base type for every failure raised by RelayHive.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
