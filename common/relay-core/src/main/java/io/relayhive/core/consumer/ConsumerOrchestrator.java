package io.relayhive.core.consumer;

import io.relayhive.core.config.ConsumerSettings;
import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.connection.ConnectionManager;
import io.relayhive.core.management.QueueMetadataManager;
import io.relayhive.core.message.EnvelopeCodec;
import io.relayhive.core.metrics.ProcessingMetrics;
import io.relayhive.core.pipeline.MessageHandler;
import io.relayhive.core.pipeline.ProcessingPipeline;
import io.relayhive.core.pipeline.ProcessorPipelineFactory;
import io.relayhive.core.retry.RetryLedger;
import io.relayhive.core.topology.TopologyNames;
import io.relayhive.core.topology.TopologyPlanner;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

/**
 * Registers processors: asserts their topology, records their metadata and runs one listener
 * container per processor.
 * <p>
 * Containers acknowledge manually, run {@code consumersCount} consumers with their own channels
 * and replace a consumer whose channel closes. Stopping a processor cancels its consumers and
 * waits up to the configured shutdown timeout for in-flight deliveries to settle.
 */
public class ConsumerOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerOrchestrator.class);

    private final ConnectionManager connections;
    private final TopologyPlanner topologyPlanner;
    private final QueueMetadataManager metadataManager;
    private final EnvelopeCodec codec;
    private final RetryLedger retryLedger;
    private final ProcessingMetrics metrics;
    private final ConsumerSettings settings;
    private final Map<String, SimpleMessageListenerContainer> containers = new LinkedHashMap<>();

    public ConsumerOrchestrator(ConnectionManager connections,
                                TopologyPlanner topologyPlanner,
                                QueueMetadataManager metadataManager,
                                EnvelopeCodec codec,
                                RetryLedger retryLedger,
                                ProcessingMetrics metrics,
                                ConsumerSettings settings) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.topologyPlanner = Objects.requireNonNull(topologyPlanner, "topologyPlanner");
        this.metadataManager = Objects.requireNonNull(metadataManager, "metadataManager");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.retryLedger = Objects.requireNonNull(retryLedger, "retryLedger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public <T> void createConsumer(String topic, ProcessorConfig config, Class<T> payloadType, MessageHandler<T> handler) {
        createConsumer(ProcessorRegistration.of(topic, config, payloadType, handler));
    }

    public <T> void createConsumer(ProcessorRegistration<T> registration) {
        Objects.requireNonNull(registration, "registration");
        ProcessorConfig config = registration.config();
        synchronized (containers) {
            if (containers.containsKey(config.name())) {
                throw new IllegalStateException("Processor '" + config.name() + "' is already registered");
            }
        }
        TopologyNames names = topologyPlanner.assertTopology(registration.topic(), config);
        if (metadataManager.isEnabled()) {
            if (!metadataManager.apply(names.main(), config.maxAttempts())) {
                log.warn("metadata not stored processor={} queue={}", config.name(), names.main());
            }
        }
        ProcessorPipelineFactory<T> pipelines = new ProcessorPipelineFactory<>(
            config,
            codec,
            codec.objectMapper().constructType(registration.payloadType()),
            registration.handler(),
            retryLedger,
            metrics);
        SimpleMessageListenerContainer container = newContainer(config, names.main(), pipelines);
        try {
            container.start();
        } catch (RuntimeException ex) {
            container.stop();
            throw new ConsumerStartException(
                "Failed to consume queue '" + names.main() + "' for processor '" + config.name() + "'", ex);
        }
        synchronized (containers) {
            containers.put(config.name(), container);
        }
        log.info("processor registered processor={} topic={} consumers={} prefetch={} maxAttempts={}",
            config.name(), registration.topic(), config.consumersCount(), settings.prefetch(), config.maxAttempts());
    }

    SimpleMessageListenerContainer newContainer(ProcessorConfig config,
                                                String queue,
                                                Supplier<ProcessingPipeline> pipelines) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connections.connectionFactory());
        container.setListenerId("relayhive." + config.name());
        container.setQueueNames(queue);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setMaxConcurrentConsumers(config.consumersCount());
        container.setConcurrentConsumers(config.consumersCount());
        container.setPrefetchCount(settings.prefetch());
        container.setShutdownTimeout(settings.shutdownTimeout().toMillis());
        container.setRecoveryInterval(settings.recoveryInterval().toMillis());
        container.setDefaultRequeueRejected(false);
        container.setMessageListener(new ProcessorListener(config.name(), queue, pipelines));
        container.afterPropertiesSet();
        return container;
    }

    public Set<String> processors() {
        synchronized (containers) {
            return Set.copyOf(containers.keySet());
        }
    }

    /**
     * Number of consumers of {@code processor} currently subscribed, zero when it is unknown or
     * stopped.
     */
    public int activeConsumers(String processor) {
        SimpleMessageListenerContainer container;
        synchronized (containers) {
            container = containers.get(processor);
        }
        return container == null || !container.isRunning() ? 0 : container.getActiveConsumerCount();
    }

    public void stop(String processor) {
        SimpleMessageListenerContainer removed;
        synchronized (containers) {
            removed = containers.remove(processor);
        }
        if (removed != null) {
            stopContainer(processor, removed);
        }
    }

    public void shutdown() {
        Map<String, SimpleMessageListenerContainer> all;
        synchronized (containers) {
            all = new LinkedHashMap<>(containers);
            containers.clear();
        }
        all.forEach(this::stopContainer);
        if (!all.isEmpty()) {
            log.info("all consumers stopped processors={}", new ArrayList<>(all.keySet()));
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private void stopContainer(String processor, SimpleMessageListenerContainer container) {
        container.stop();
        container.destroy();
        log.info("consumers stopped processor={} queues={}", processor, List.of(container.getQueueNames()));
    }
}
