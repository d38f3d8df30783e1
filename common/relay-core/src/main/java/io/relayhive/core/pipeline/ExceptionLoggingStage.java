package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.metrics.ProcessingMetrics;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outermost stage: logs whatever still escapes the pipeline and rethrows it.
 */
public final class ExceptionLoggingStage implements ProcessingStage {

    private static final Logger log = LoggerFactory.getLogger(ExceptionLoggingStage.class);

    private final ProcessingMetrics metrics;

    public ExceptionLoggingStage(ProcessingMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        try {
            return chain.proceed(message);
        } catch (RuntimeException ex) {
            log.error("unhandled failure escaped pipeline queue={} deliveryTag={} messageId={}",
                message.queue(), message.deliveryTag(), message.messageId(), ex);
            metrics.record(message.queue(), DeliveryOutcome.FATAL_ESCALATED);
            throw ex;
        }
    }
}
