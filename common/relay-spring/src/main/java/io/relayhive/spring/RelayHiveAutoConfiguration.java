package io.relayhive.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.relayhive.core.RelayHive;
import io.relayhive.core.config.ConnectionSettings;
import io.relayhive.core.connection.ConnectionManager;
import io.relayhive.core.consumer.ProcessorRegistration;
import java.net.URI;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link RelayHive} instance and starts the application's processors with the context.
 * <p>
 * The connection comes from {@code relayhive.connection.url} when set, otherwise from the
 * application's Spring AMQP {@link ConnectionFactory}.
 */
@AutoConfiguration(after = RabbitAutoConfiguration.class)
@ConditionalOnClass(RelayHive.class)
@ConditionalOnProperty(prefix = "relayhive", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RelayHiveProperties.class)
public class RelayHiveAutoConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    ConnectionManager relayHiveConnectionManager(RelayHiveProperties properties,
                                                 ObjectProvider<ConnectionFactory> connectionFactory) {
        RelayHiveProperties.Connection connection = properties.getConnection();
        if (connection.getUrl() != null && !connection.getUrl().isBlank()) {
            return ConnectionManager.forSettings(new ConnectionSettings(
                URI.create(connection.getUrl()),
                connection.getReconnectDelay(),
                connection.getMaxReconnectAttempts()));
        }
        ConnectionFactory factory = connectionFactory.getIfAvailable();
        if (factory == null) {
            throw new IllegalStateException(
                "relayhive.connection.url must be set when no Spring AMQP ConnectionFactory is available");
        }
        return new ConnectionManager(factory, connection.getReconnectDelay(), connection.getMaxReconnectAttempts());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    RelayHive relayHive(ConnectionManager connectionManager,
                        RelayHiveProperties properties,
                        ObjectProvider<ObjectMapper> objectMapper,
                        ObjectProvider<MeterRegistry> meterRegistry) {
        RelayHive.Builder builder = RelayHive.builder()
            .connectionManager(connectionManager)
            .consumer(properties.getConsumer().toSettings())
            .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new));
        meterRegistry.ifAvailable(builder::meterRegistry);
        if (properties.getManagement().isEnabled()) {
            builder.management(properties.getManagement().toSettings());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    ProcessorRegistrar relayHiveProcessorRegistrar(RelayHive relayHive,
                                                   ObjectProvider<ProcessorRegistration<?>> registrations,
                                                   RelayHiveProperties properties,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new ProcessorRegistrar(
            relayHive,
            registrations.orderedStream().toList(),
            properties,
            objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
