package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.metrics.ProcessingMetrics;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects failed deliveries without requeue, so the main queue dead-letters them into the retry
 * queue. {@link AcknowledgeAfterDeadLetterException} is passed through untouched.
 */
public final class FailedRejecterStage implements ProcessingStage {

    private static final Logger log = LoggerFactory.getLogger(FailedRejecterStage.class);

    private final ProcessingMetrics metrics;

    public FailedRejecterStage(ProcessingMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        try {
            return chain.proceed(message);
        } catch (AcknowledgeAfterDeadLetterException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            message.nack(false);
            log.warn("delivery rejected for retry queue={} messageId={} error={}",
                message.queue(), message.messageId(), ex.toString());
            metrics.record(message.queue(), DeliveryOutcome.RETRY_PENDING);
            return false;
        }
    }
}
