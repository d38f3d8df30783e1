package io.relayhive.core.message;

import io.relayhive.core.RelayException;
import java.util.Objects;

/**
 * Raised when a message body cannot be turned into an {@link Envelope}.
 */
public class MessageDeserializationException extends RelayException {

    public enum Reason {
        /** The body has no bytes or only whitespace. */
        EMPTY_BODY,
        /** The body is not parseable JSON. */
        MALFORMED_JSON,
        /** The JSON lacks a well-typed {@code message}, {@code meta.id} or {@code meta.publishedAt}. */
        INVALID_ENVELOPE,
        /** The {@code message} part cannot be bound to the processor's payload type. */
        PAYLOAD_MISMATCH
    }

    private final Reason reason;

    public MessageDeserializationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public MessageDeserializationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
