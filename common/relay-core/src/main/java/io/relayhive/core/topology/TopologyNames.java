package io.relayhive.core.topology;

import java.util.Objects;

/**
 * Queue and exchange names of one processor, all derived from the processor name.
 *
 * @param main queue the processor consumes from
 * @param retry queue that holds rejected messages until their TTL expires
 * @param deadLetter terminal queue for messages that exhausted their attempts
 */
public record TopologyNames(String main, String retry, String deadLetter) {

    public static final String ROUTER_EXCHANGE = "relayhive.router";
    public static final String DEAD_LETTER_EXCHANGE = "relayhive.dead-letter";
    public static final String RETRY_QUEUE_PREFIX = "relayhive.retry.";
    public static final String DEAD_LETTER_QUEUE_PREFIX = "relayhive.dlq.";

    public TopologyNames {
        Objects.requireNonNull(main, "main");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(deadLetter, "deadLetter");
    }

    public static TopologyNames forProcessor(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("processor name must not be null or blank");
        }
        return new TopologyNames(name, RETRY_QUEUE_PREFIX + name, DEAD_LETTER_QUEUE_PREFIX + name);
    }
}
