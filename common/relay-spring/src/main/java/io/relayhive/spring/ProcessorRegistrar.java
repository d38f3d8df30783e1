package io.relayhive.spring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relayhive.core.RelayHive;
import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.consumer.ProcessorRegistration;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.io.Resource;

/**
 * Starts {@link RelayHive} and registers every {@link ProcessorRegistration} bean once the
 * application context is refreshed; stops the consumers when the context closes.
 * <p>
 * {@code relayhive.processors.<name>.*} properties override the matching registration.
 */
public class ProcessorRegistrar implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistrar.class);

    private final RelayHive relayHive;
    private final List<ProcessorRegistration<?>> registrations;
    private final RelayHiveProperties properties;
    private final ObjectMapper json;
    private volatile boolean running;

    public ProcessorRegistrar(RelayHive relayHive,
                              List<ProcessorRegistration<?>> registrations,
                              RelayHiveProperties properties,
                              ObjectMapper json) {
        this.relayHive = Objects.requireNonNull(relayHive, "relayHive");
        this.registrations = List.copyOf(registrations);
        this.properties = Objects.requireNonNull(properties, "properties");
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public void start() {
        relayHive.start();
        for (ProcessorRegistration<?> registration : registrations) {
            relayHive.process(resolve(registration));
        }
        running = true;
        log.info("RelayHive processors registered count={}", registrations.size());
    }

    @Override
    public void stop() {
        running = false;
        relayHive.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 1024;
    }

    <T> ProcessorRegistration<T> resolve(ProcessorRegistration<T> registration) {
        String name = registration.config().name();
        RelayHiveProperties.Processor overrides = properties.getProcessors().get(name);
        if (overrides == null) {
            return registration;
        }
        ProcessorConfig.Builder builder = registration.config().toBuilder();
        overrides.applyTo(builder);
        if (overrides.getMessageSchema() != null) {
            builder.schema(readSchema(name, overrides.getMessageSchema()));
        }
        String topic = overrides.getTopic() != null && !overrides.getTopic().isBlank()
            ? overrides.getTopic()
            : registration.topic();
        return ProcessorRegistration.of(topic, builder.build(), registration.payloadType(), registration.handler());
    }

    private JsonNode readSchema(String processor, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return json.readTree(in);
        } catch (IOException ex) {
            throw new IllegalStateException("relayhive.processors." + processor
                + ".message-schema could not be read from " + resource.getDescription(), ex);
        }
    }
}
