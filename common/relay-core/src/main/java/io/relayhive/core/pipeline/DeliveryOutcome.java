package io.relayhive.core.pipeline;

/**
 * Terminal state of one delivery after the pipeline ran.
 */
public enum DeliveryOutcome {
    /** Handler succeeded, delivery acknowledged. */
    SUCCEEDED("succeeded"),
    /** Handler failed below the attempt limit, delivery negatively acknowledged into the retry queue. */
    RETRY_PENDING("retried"),
    /** Handler failed at the attempt limit, delivery copied to the dead-letter queue and acknowledged. */
    DEAD_LETTERED("dead_lettered"),
    /** A failure escaped the pipeline; the delivery stays unacknowledged until its channel closes. */
    FATAL_ESCALATED("escalated");

    private final String tag;

    DeliveryOutcome(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
