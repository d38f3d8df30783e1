package io.relayhive.core.message;

import java.util.Objects;

/**
 * Delivery metadata stamped on every published envelope.
 *
 * @param id unique identifier of one publish call
 * @param publishedAt publish time in epoch milliseconds
 */
public record EnvelopeMeta(String id, long publishedAt) {

    public EnvelopeMeta {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }
}
