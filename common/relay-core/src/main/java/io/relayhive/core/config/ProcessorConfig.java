package io.relayhive.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable registration settings of a single processor.
 * <p>
 * The processor name is the only input to queue naming; see
 * {@link io.relayhive.core.topology.TopologyNames}.
 */
public final class ProcessorConfig {

    public static final int DEFAULT_CONSUMERS_COUNT = 1;
    public static final int DEFAULT_MAX_ATTEMPTS = 1;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
    /** Shortest delay the broker can express as a message TTL. */
    public static final Duration MIN_RETRY_DELAY = Duration.ofMillis(1);
    /** {@code x-message-ttl} is a signed 32-bit millisecond value. */
    public static final Duration MAX_RETRY_DELAY = Duration.ofMillis(Integer.MAX_VALUE);

    private final String name;
    private final int consumersCount;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final boolean usePolicyForDelay;
    private final JsonNode schema;

    private ProcessorConfig(Builder builder) {
        this.name = requireText(builder.name, "name");
        if (builder.consumersCount < 1) {
            throw new IllegalArgumentException("consumersCount must be at least 1 but was " + builder.consumersCount);
        }
        if (builder.maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative but was " + builder.maxAttempts);
        }
        Objects.requireNonNull(builder.retryDelay, "retryDelay");
        if (builder.retryDelay.compareTo(MIN_RETRY_DELAY) < 0 || builder.retryDelay.compareTo(MAX_RETRY_DELAY) > 0) {
            throw new IllegalArgumentException("retryDelay must be between " + MIN_RETRY_DELAY.toMillis()
                + " and " + MAX_RETRY_DELAY.toMillis() + " ms but was " + builder.retryDelay);
        }
        this.consumersCount = builder.consumersCount;
        this.maxAttempts = builder.maxAttempts;
        this.retryDelay = builder.retryDelay;
        this.usePolicyForDelay = builder.usePolicyForDelay;
        this.schema = builder.schema == null ? null : builder.schema.deepCopy();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public int consumersCount() {
        return consumersCount;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public boolean usePolicyForDelay() {
        return usePolicyForDelay;
    }

    /**
     * JSON schema applied to the {@code message} part of each envelope, when configured.
     */
    public Optional<JsonNode> schema() {
        return Optional.ofNullable(schema).map(JsonNode::deepCopy);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name)
            .consumersCount(consumersCount)
            .maxAttempts(maxAttempts)
            .retryDelay(retryDelay)
            .usePolicyForDelay(usePolicyForDelay);
        builder.schema = schema;
        return builder;
    }

    @Override
    public String toString() {
        return "ProcessorConfig{"
            + "name='" + name + '\''
            + ", consumersCount=" + consumersCount
            + ", maxAttempts=" + maxAttempts
            + ", retryDelay=" + retryDelay
            + ", usePolicyForDelay=" + usePolicyForDelay
            + ", schema=" + (schema != null)
            + '}';
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }

    public static final class Builder {
        private final String name;
        private int consumersCount = DEFAULT_CONSUMERS_COUNT;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private boolean usePolicyForDelay;
        private JsonNode schema;

        private Builder(String name) {
            this.name = name;
        }

        public Builder consumersCount(int consumersCount) {
            this.consumersCount = consumersCount;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
            return this;
        }

        public Builder usePolicyForDelay(boolean usePolicyForDelay) {
            this.usePolicyForDelay = usePolicyForDelay;
            return this;
        }

        public Builder schema(JsonNode schema) {
            this.schema = schema;
            return this;
        }

        public ProcessorConfig build() {
            return new ProcessorConfig(this);
        }
    }
}
