package io.relayhive.core.topology;

/**
 * Raised when a processor delegates its retry delay to a broker policy and the policy could
 * not be applied. The retry queue would otherwise hold rejected messages forever.
 */
public class TtlPolicyUndefinedException extends TopologyException {

    private final String queueName;

    public TtlPolicyUndefinedException(String queueName) {
        super("TTL policy undefined for retry queue '" + queueName + "'");
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }
}
