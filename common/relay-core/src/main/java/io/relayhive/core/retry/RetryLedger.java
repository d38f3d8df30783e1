package io.relayhive.core.retry;

import io.relayhive.core.message.InboundMessage;

/**
 * Derives how many times a delivery has already been attempted, using only state the broker
 * carries on the message itself.
 */
@FunctionalInterface
public interface RetryLedger {

    /**
     * Returns the attempt count the pipeline compares against the processor's maximum.
     * {@code 0} means the message has never been rejected.
     */
    int attempts(InboundMessage message);
}
