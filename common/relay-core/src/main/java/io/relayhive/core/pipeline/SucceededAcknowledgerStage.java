package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.metrics.ProcessingMetrics;
import java.util.Objects;

/**
 * Acknowledges deliveries whose inner stages succeeded.
 */
public final class SucceededAcknowledgerStage implements ProcessingStage {

    private final ProcessingMetrics metrics;

    public SucceededAcknowledgerStage(ProcessingMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        boolean succeeded = chain.proceed(message);
        if (succeeded) {
            message.ack();
            metrics.record(message.queue(), DeliveryOutcome.SUCCEEDED);
        }
        return succeeded;
    }
}
