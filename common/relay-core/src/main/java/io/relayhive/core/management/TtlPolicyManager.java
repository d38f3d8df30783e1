package io.relayhive.core.management;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the retry delay of a queue as an operator policy instead of a queue argument, so the
 * delay can change without redeclaring the queue.
 */
public class TtlPolicyManager extends ManagementCapability {

    public TtlPolicyManager(RabbitManagementClient client) {
        super(client, "TTL policies");
    }

    public static TtlPolicyManager disabled() {
        return new TtlPolicyManager(null);
    }

    /**
     * Creates or replaces the TTL policy of {@code queueName}.
     *
     * @return {@code true} when the broker accepted the policy
     */
    public boolean apply(String queueName, Duration ttl) {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(ttl, "ttl");
        return client()
            .map(c -> c.putOperatorPolicy(OperatorPolicy.messageTtl(queueName, ttl)))
            .orElse(false);
    }

    public Optional<OperatorPolicy> get(String queueName) {
        return client().flatMap(c -> c.getOperatorPolicy(OperatorPolicy.ttlPolicyName(queueName)));
    }

    /**
     * Deletes the TTL policy of {@code queueName}; a policy that does not exist counts as deleted.
     */
    public boolean cleanup(String queueName) {
        return client()
            .map(c -> c.deleteOperatorPolicy(OperatorPolicy.ttlPolicyName(queueName)))
            .orElse(false);
    }
}
