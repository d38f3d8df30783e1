package io.relayhive.core.pipeline;

import io.relayhive.core.RelayException;

/**
 * Wraps a failure thrown by a {@link MessageHandler}.
 */
public class MessageProcessingException extends RelayException {

    public MessageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
