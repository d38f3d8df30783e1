package io.relayhive.core.consumer;

import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.pipeline.MessageHandler;
import java.util.Objects;

/**
 * Everything needed to start consuming for one processor.
 *
 * @param topic routing key publishers use to reach the processor
 * @param config processor settings
 * @param payloadType type the {@code message} part of each envelope is bound to
 * @param handler callback invoked for every valid delivery
 */
public record ProcessorRegistration<T>(String topic, ProcessorConfig config, Class<T> payloadType, MessageHandler<T> handler) {

    public ProcessorRegistration {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(handler, "handler");
    }

    public static <T> ProcessorRegistration<T> of(String topic,
                                                  ProcessorConfig config,
                                                  Class<T> payloadType,
                                                  MessageHandler<T> handler) {
        return new ProcessorRegistration<>(topic, config, payloadType, handler);
    }
}
