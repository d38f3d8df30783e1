package io.relayhive.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.relayhive.core.pipeline.DeliveryOutcome;
import java.util.Objects;

/**
 * Micrometer counters for consumed and published messages.
 */
public final class ProcessingMetrics {

    public static final String MESSAGES = "relayhive.messages";
    public static final String PUBLISH = "relayhive.publish";

    private final MeterRegistry meterRegistry;

    public ProcessingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public static ProcessingMetrics simple() {
        return new ProcessingMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }

    public void record(String processor, DeliveryOutcome outcome) {
        Counter.builder(MESSAGES)
            .description("Deliveries processed by RelayHive consumers")
            .tag("processor", processor == null ? "unknown" : processor)
            .tag("outcome", outcome.tag())
            .register(meterRegistry)
            .increment();
    }

    public void recordPublish(String topic, boolean success) {
        Counter.builder(PUBLISH)
            .description("Envelopes published by RelayHive")
            .tag("topic", topic == null ? "unknown" : topic)
            .tag("outcome", success ? "success" : "failure")
            .register(meterRegistry)
            .increment();
    }
}
