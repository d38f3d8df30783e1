package io.relayhive.core.message;

import java.util.Objects;

/**
 * Wire form of every message: the caller's payload plus {@link EnvelopeMeta}.
 * <pre>
 * {"message": {...}, "meta": {"id": "...", "publishedAt": 1700000000000}}
 * </pre>
 */
public record Envelope<T>(T message, EnvelopeMeta meta) {

    public Envelope {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(meta, "meta");
    }
}
