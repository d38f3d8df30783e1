package io.relayhive.spring;

import io.relayhive.core.config.ConnectionSettings;
import io.relayhive.core.config.ConsumerSettings;
import io.relayhive.core.config.ManagementSettings;
import io.relayhive.core.config.ProcessorConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties that drive the RelayHive auto-configuration.
 */
@Validated
@ConfigurationProperties(prefix = "relayhive")
public class RelayHiveProperties {

    private boolean enabled = true;
    @Valid
    private final Connection connection = new Connection();
    @Valid
    private final Consumer consumer = new Consumer();
    private final Management management = new Management();
    @Valid
    private final Map<String, Processor> processors = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Connection getConnection() {
        return connection;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Management getManagement() {
        return management;
    }

    public Map<String, Processor> getProcessors() {
        return processors;
    }

    public static class Connection {
        /**
         * AMQP URI. When unset the application's Spring AMQP connection factory is used.
         */
        private String url;
        private Duration reconnectDelay = ConnectionSettings.DEFAULT_RECONNECT_DELAY;
        @Min(1)
        private int maxReconnectAttempts = ConnectionSettings.DEFAULT_MAX_RECONNECT_ATTEMPTS;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }

        public int getMaxReconnectAttempts() {
            return maxReconnectAttempts;
        }

        public void setMaxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
        }
    }

    public static class Consumer {
        @Min(1)
        private int prefetch = ConsumerSettings.DEFAULT_PREFETCH;
        /** How long stopping waits for in-flight deliveries before channels are closed. */
        private Duration shutdownTimeout = ConsumerSettings.DEFAULT_SHUTDOWN_TIMEOUT;
        private Duration recoveryInterval = ConsumerSettings.DEFAULT_RECOVERY_INTERVAL;

        public int getPrefetch() {
            return prefetch;
        }

        public void setPrefetch(int prefetch) {
            this.prefetch = prefetch;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getRecoveryInterval() {
            return recoveryInterval;
        }

        public void setRecoveryInterval(Duration recoveryInterval) {
            this.recoveryInterval = recoveryInterval;
        }

        public ConsumerSettings toSettings() {
            return new ConsumerSettings(prefetch, shutdownTimeout, recoveryInterval);
        }
    }

    public static class Management {
        private boolean enabled;
        private String url = "http://localhost:15672";
        private String username = "guest";
        private String password = "guest";
        private String vhost = ManagementSettings.DEFAULT_VHOST;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getVhost() {
            return vhost;
        }

        public void setVhost(String vhost) {
            this.vhost = vhost;
        }

        ManagementSettings toSettings() {
            return ManagementSettings.of(url, username, password).withVhost(vhost);
        }
    }

    /**
     * Per-processor overrides, keyed by processor name. Unset values keep what the
     * {@link io.relayhive.core.consumer.ProcessorRegistration} bean declares.
     */
    public static class Processor {
        private String topic;
        @Min(1)
        private Integer consumersCount;
        @Min(0)
        private Integer maxAttempts;
        private Duration attemptsDelay;
        private Boolean usePoliciesForDelay;
        private Resource messageSchema;

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public Integer getConsumersCount() {
            return consumersCount;
        }

        public void setConsumersCount(Integer consumersCount) {
            this.consumersCount = consumersCount;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getAttemptsDelay() {
            return attemptsDelay;
        }

        public void setAttemptsDelay(Duration attemptsDelay) {
            this.attemptsDelay = attemptsDelay;
        }

        public Boolean getUsePoliciesForDelay() {
            return usePoliciesForDelay;
        }

        public void setUsePoliciesForDelay(Boolean usePoliciesForDelay) {
            this.usePoliciesForDelay = usePoliciesForDelay;
        }

        public Resource getMessageSchema() {
            return messageSchema;
        }

        public void setMessageSchema(Resource messageSchema) {
            this.messageSchema = messageSchema;
        }

        void applyTo(ProcessorConfig.Builder builder) {
            if (consumersCount != null) {
                builder.consumersCount(consumersCount);
            }
            if (maxAttempts != null) {
                builder.maxAttempts(maxAttempts);
            }
            if (attemptsDelay != null) {
                builder.retryDelay(attemptsDelay);
            }
            if (usePoliciesForDelay != null) {
                builder.usePolicyForDelay(usePoliciesForDelay);
            }
        }
    }
}
