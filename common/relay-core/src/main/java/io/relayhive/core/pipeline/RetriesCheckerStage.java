package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.metrics.ProcessingMetrics;
import io.relayhive.core.retry.RetryLedger;
import io.relayhive.core.topology.TopologyNames;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides between another retry cycle and the dead-letter queue.
 * <p>
 * Below the attempt limit the failure is rethrown so the delivery is rejected into the retry
 * queue. At the limit the original body and properties are published to the dead-letter
 * router, the delivery is acknowledged and {@code false} is returned.
 */
public final class RetriesCheckerStage implements ProcessingStage {

    private static final Logger log = LoggerFactory.getLogger(RetriesCheckerStage.class);

    private final int maxAttempts;
    private final TopologyNames names;
    private final RetryLedger retryLedger;
    private final ProcessingMetrics metrics;

    public RetriesCheckerStage(int maxAttempts, TopologyNames names, RetryLedger retryLedger, ProcessingMetrics metrics) {
        this.maxAttempts = maxAttempts;
        this.names = Objects.requireNonNull(names, "names");
        this.retryLedger = Objects.requireNonNull(retryLedger, "retryLedger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        try {
            return chain.proceed(message);
        } catch (RuntimeException ex) {
            int attempts = retryLedger.attempts(message);
            if (attempts < maxAttempts) {
                log.debug("retry scheduled queue={} messageId={} attempts={} max={}",
                    message.queue(), message.messageId(), attempts, maxAttempts);
                throw ex;
            }
            log.error("max attempts reached, moving to dead-letter queue queue={} dlq={} messageId={} attempts={} max={} payload={}",
                message.queue(), names.deadLetter(), message.messageId(), attempts, maxAttempts, message.bodyAsString());
            message.republish(TopologyNames.DEAD_LETTER_EXCHANGE, names.deadLetter());
            try {
                message.ack();
            } catch (RuntimeException ackFailure) {
                log.error("acknowledge failed after publishing to dead-letter queue queue={} messageId={} cause={}",
                    message.queue(), message.messageId(), ackFailure.toString());
                throw new AcknowledgeAfterDeadLetterException(
                    "A message acknowledge failed after publishing to dead-letter queue " + names.deadLetter(),
                    ackFailure);
            }
            metrics.record(message.queue(), DeliveryOutcome.DEAD_LETTERED);
            return false;
        }
    }
}
