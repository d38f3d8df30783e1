package io.relayhive.core.pipeline;

import io.relayhive.core.RelayException;

/**
 * Raised when a delivery was copied to its dead-letter queue but the original could not be
 * acknowledged. The message may now exist twice, so this failure is never retried locally.
 */
public class AcknowledgeAfterDeadLetterException extends RelayException {

    public AcknowledgeAfterDeadLetterException(String message, Throwable cause) {
        super(message, cause);
    }
}
