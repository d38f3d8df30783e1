package io.relayhive.core.pipeline;

import com.fasterxml.jackson.databind.JavaType;
import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.message.EnvelopeCodec;
import io.relayhive.core.metrics.ProcessingMetrics;
import io.relayhive.core.retry.RetryLedger;
import io.relayhive.core.schema.MessageSchemaValidator;
import io.relayhive.core.topology.TopologyNames;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds the standard pipeline of one processor:
 * exception logging, success acknowledgement, failure rejection, retry checking, failure
 * logging and finally the handler.
 * <p>
 * Every call to {@link #get()} returns fresh stage instances; the schema is compiled once.
 */
public final class ProcessorPipelineFactory<T> implements Supplier<ProcessingPipeline> {

    private final ProcessorConfig config;
    private final TopologyNames names;
    private final EnvelopeCodec codec;
    private final JavaType payloadType;
    private final MessageHandler<T> handler;
    private final RetryLedger retryLedger;
    private final ProcessingMetrics metrics;
    private final MessageSchemaValidator validator;

    public ProcessorPipelineFactory(ProcessorConfig config,
                                    EnvelopeCodec codec,
                                    JavaType payloadType,
                                    MessageHandler<T> handler,
                                    RetryLedger retryLedger,
                                    ProcessingMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.names = TopologyNames.forProcessor(config.name());
        this.codec = Objects.requireNonNull(codec, "codec");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.retryLedger = Objects.requireNonNull(retryLedger, "retryLedger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.validator = config.schema().map(MessageSchemaValidator::new).orElse(null);
    }

    @Override
    public ProcessingPipeline get() {
        return ProcessingPipeline.builder()
            .stage(new ExceptionLoggingStage(metrics))
            .stage(new SucceededAcknowledgerStage(metrics))
            .stage(new FailedRejecterStage(metrics))
            .stage(new RetriesCheckerStage(config.maxAttempts(), names, retryLedger, metrics))
            .stage(new FailureLoggingStage())
            .stage(new MessageHandlerStage<>(codec, payloadType, validator, handler))
            .build();
    }
}
