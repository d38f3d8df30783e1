package io.relayhive.core.publisher;

import io.relayhive.core.message.Envelope;
import io.relayhive.core.metrics.ProcessingMetrics;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs and counts publish failures before handing them back to the caller.
 */
public final class FailureLoggingEnvelopePublisher implements EnvelopePublisher {

    private static final Logger log = LoggerFactory.getLogger(FailureLoggingEnvelopePublisher.class);

    private final EnvelopePublisher delegate;
    private final ProcessingMetrics metrics;

    public FailureLoggingEnvelopePublisher(EnvelopePublisher delegate, ProcessingMetrics metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public <T> Envelope<T> publish(String topic, T payload) {
        try {
            Envelope<T> envelope = delegate.publish(topic, payload);
            metrics.recordPublish(topic, true);
            return envelope;
        } catch (RuntimeException ex) {
            log.error("publish failed topic={} payload={} error={}", topic, payload, ex.toString(), ex);
            metrics.recordPublish(topic, false);
            throw ex;
        }
    }
}
