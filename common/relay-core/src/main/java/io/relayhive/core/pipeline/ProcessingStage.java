package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;

/**
 * One step of a {@link ProcessingPipeline}.
 * <p>
 * A stage returns {@code true} when the delivery succeeded, {@code false} when a failure has
 * already been handled further in, or throws.
 */
@FunctionalInterface
public interface ProcessingStage {

    boolean process(InboundMessage message, Chain chain);

    interface Chain {
        /**
         * Invokes the next stage.
         */
        boolean proceed(InboundMessage message);
    }
}
