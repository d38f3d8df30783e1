package io.relayhive.core.message;

import io.relayhive.core.RelayException;

/**
 * Raised when an acknowledge, negative acknowledge or republish of a delivery fails on the
 * channel.
 */
public class MessageSettlementException extends RelayException {

    public MessageSettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
