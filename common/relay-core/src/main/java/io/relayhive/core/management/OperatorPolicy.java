package io.relayhive.core.management;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Broker-side operator policy as exchanged with the management API.
 *
 * @param name policy name, unique per virtual host
 * @param pattern regular expression matched against queue names
 * @param definition policy keys, for example {@code message-ttl}
 * @param applyTo kind of object the policy applies to
 * @param priority precedence over other policies matching the same queue
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperatorPolicy(
    String name,
    String pattern,
    Map<String, Object> definition,
    @JsonProperty("apply-to") String applyTo,
    int priority) {

    public static final String TTL_POLICY_PREFIX = "relayhive-ttl-";
    public static final int TTL_POLICY_PRIORITY = 1000;
    public static final String APPLY_TO_QUEUES = "queues";
    private static final String REGEX_META = ".*+?^${}()|[]\\";

    public OperatorPolicy {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        definition = definition == null ? Map.of() : Map.copyOf(definition);
        if (applyTo == null || applyTo.isBlank()) {
            applyTo = APPLY_TO_QUEUES;
        }
    }

    /**
     * Policy that sets {@code message-ttl} on exactly the given queue.
     */
    public static OperatorPolicy messageTtl(String queueName, Duration ttl) {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(ttl, "ttl");
        return new OperatorPolicy(
            ttlPolicyName(queueName),
            "^" + escapeRegex(queueName) + "$",
            Map.of("message-ttl", ttl.toMillis()),
            APPLY_TO_QUEUES,
            TTL_POLICY_PRIORITY);
    }

    public static String ttlPolicyName(String queueName) {
        return TTL_POLICY_PREFIX + queueName;
    }

    static String escapeRegex(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (REGEX_META.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
