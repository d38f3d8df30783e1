package io.relayhive.core.connection;

import io.relayhive.core.config.ConnectionSettings;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

/**
 * Owns the broker connection used by consumers, the publisher and topology declarations.
 * <p>
 * {@link #initialize()} connects with a bounded number of attempts and a fixed delay between
 * them. Listener containers, the publisher and topology declarations draw their channels from
 * {@link #connectionFactory()}.
 */
public final class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConnectionFactory connectionFactory;
    private final Duration reconnectDelay;
    private final int maxAttempts;
    private final boolean ownsFactory;
    private volatile Connection connection;

    public ConnectionManager(ConnectionFactory connectionFactory, Duration reconnectDelay, int maxAttempts) {
        this(connectionFactory, reconnectDelay, maxAttempts, false);
    }

    private ConnectionManager(ConnectionFactory connectionFactory,
                              Duration reconnectDelay,
                              int maxAttempts,
                              boolean ownsFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.ownsFactory = ownsFactory;
    }

    /**
     * Creates a manager backed by a {@link CachingConnectionFactory} for the configured URI. The
     * factory is destroyed on {@link #shutdown()}.
     */
    public static ConnectionManager forSettings(ConnectionSettings settings) {
        Objects.requireNonNull(settings, "settings");
        CachingConnectionFactory factory = new CachingConnectionFactory();
        factory.setUri(settings.url());
        return new ConnectionManager(factory, settings.reconnectDelay(), settings.maxReconnectAttempts(), true);
    }

    public ConnectionFactory connectionFactory() {
        return connectionFactory;
    }

    public synchronized void initialize() {
        if (connection != null && connection.isOpen()) {
            return;
        }
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.info("Connecting to RabbitMQ (attempt {}/{})", attempt, maxAttempts);
                connection = connectionFactory.createConnection();
                log.info("Connected to RabbitMQ at {}:{}", connectionFactory.getHost(), connectionFactory.getPort());
                return;
            } catch (RuntimeException ex) {
                lastError = ex;
                log.warn("Failed to connect to RabbitMQ (attempt {}/{}): {}", attempt, maxAttempts, ex.getMessage());
                if (attempt < maxAttempts) {
                    pause();
                }
            }
        }
        throw new RelayConnectionException(
            "Unable to connect to RabbitMQ after " + maxAttempts + " attempts", maxAttempts, lastError);
    }

    public boolean isConnected() {
        Connection current = connection;
        return current != null && current.isOpen();
    }

    public synchronized void shutdown() {
        Connection current = connection;
        connection = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close RabbitMQ connection: {}", ex.getMessage());
            }
        }
        if (ownsFactory && connectionFactory instanceof CachingConnectionFactory caching) {
            caching.destroy();
        }
        log.info("RabbitMQ connection closed");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void pause() {
        if (reconnectDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(reconnectDelay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RelayConnectionException("Interrupted while waiting to reconnect to RabbitMQ", 0, ex);
        }
    }
}
