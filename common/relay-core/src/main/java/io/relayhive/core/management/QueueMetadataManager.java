package io.relayhive.core.management;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link QueueMetadata} record per processor queue in the broker's global parameters.
 */
public class QueueMetadataManager extends ManagementCapability {

    private static final Logger log = LoggerFactory.getLogger(QueueMetadataManager.class);

    private final ObjectMapper json;
    private final Clock clock;

    public QueueMetadataManager(RabbitManagementClient client, ObjectMapper json) {
        this(client, json, Clock.systemUTC());
    }

    public QueueMetadataManager(RabbitManagementClient client, ObjectMapper json, Clock clock) {
        super(client, "queue metadata");
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static QueueMetadataManager disabled(ObjectMapper json) {
        return new QueueMetadataManager(null, json);
    }

    /**
     * Writes the metadata of {@code queueName}. An existing record keeps its creation time and
     * gets a fresh update time.
     *
     * @return {@code true} when the record was stored
     */
    public boolean apply(String queueName, int maxRetries) {
        Objects.requireNonNull(queueName, "queueName");
        Optional<RabbitManagementClient> client = client();
        if (client.isEmpty()) {
            log.warn("metadata for queue={} not stored, management API unavailable", queueName);
            return false;
        }
        Optional<QueueMetadata> existing = get(queueName);
        QueueMetadata metadata = QueueMetadata.next(maxRetries, existing.orElse(null), clock.instant());
        JsonNode value = json.valueToTree(metadata);
        boolean stored = client.get().putGlobalParameter(QueueMetadata.parameterName(queueName), value);
        if (stored) {
            log.info("{} metadata for queue={} maxRetries={}",
                existing.isPresent() ? "updated" : "created", queueName, maxRetries);
        }
        return stored;
    }

    public Optional<QueueMetadata> get(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        return client()
            .flatMap(c -> c.getGlobalParameter(QueueMetadata.parameterName(queueName)))
            .flatMap(this::toMetadata);
    }

    public boolean cleanup(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        return client()
            .map(c -> c.deleteGlobalParameter(QueueMetadata.parameterName(queueName)))
            .orElse(false);
    }

    private Optional<QueueMetadata> toMetadata(JsonNode value) {
        try {
            return Optional.of(json.treeToValue(value, QueueMetadata.class));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("stored metadata could not be read: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
