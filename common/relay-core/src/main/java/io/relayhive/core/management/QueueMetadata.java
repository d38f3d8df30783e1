package io.relayhive.core.management;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;

/**
 * Versioned description of a processor queue, stored as a broker global parameter.
 *
 * @param version layout version of this record
 * @param maxRetries attempts configured for the processor
 * @param createdAt ISO-8601 time of the first write
 * @param updatedAt ISO-8601 time of the last rewrite, {@code null} until the record is rewritten
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueMetadata(int version, int maxRetries, String createdAt, String updatedAt) {

    public static final int CURRENT_VERSION = 0;
    public static final String PARAMETER_PREFIX = "relayhive-metadata-";

    public QueueMetadata {
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Record to write for {@code maxRetries}, keeping the creation time of {@code existing}.
     */
    public static QueueMetadata next(int maxRetries, QueueMetadata existing, Instant now) {
        String timestamp = now.toString();
        if (existing == null) {
            return new QueueMetadata(CURRENT_VERSION, maxRetries, timestamp, null);
        }
        return new QueueMetadata(CURRENT_VERSION, maxRetries, existing.createdAt(), timestamp);
    }

    public static String parameterName(String queueName) {
        return PARAMETER_PREFIX + queueName;
    }
}
