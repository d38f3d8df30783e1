package io.relayhive.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Listener container settings shared by every processor.
 *
 * @param prefetch unacknowledged deliveries each consumer may hold
 * @param shutdownTimeout how long stopping waits for in-flight deliveries before channels are
 *                        closed anyway
 * @param recoveryInterval pause before a consumer whose start failed is tried again
 */
public record ConsumerSettings(int prefetch, Duration shutdownTimeout, Duration recoveryInterval) {

    public static final int DEFAULT_PREFETCH = 10;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECOVERY_INTERVAL = Duration.ofSeconds(5);

    public ConsumerSettings {
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be at least 1 but was " + prefetch);
        }
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(recoveryInterval, "recoveryInterval");
        if (shutdownTimeout.isNegative() || recoveryInterval.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout and recoveryInterval must not be negative");
        }
    }

    public static ConsumerSettings defaults() {
        return new ConsumerSettings(DEFAULT_PREFETCH, DEFAULT_SHUTDOWN_TIMEOUT, DEFAULT_RECOVERY_INTERVAL);
    }

    public ConsumerSettings withPrefetch(int value) {
        return new ConsumerSettings(value, shutdownTimeout, recoveryInterval);
    }
}
