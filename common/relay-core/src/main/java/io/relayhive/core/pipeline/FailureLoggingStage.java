package io.relayhive.core.pipeline;

import io.relayhive.core.message.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the payload and stack of every failure from the handler, then rethrows it unchanged.
 */
public final class FailureLoggingStage implements ProcessingStage {

    private static final Logger log = LoggerFactory.getLogger(FailureLoggingStage.class);

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        try {
            return chain.proceed(message);
        } catch (RuntimeException ex) {
            log.error("processing failed queue={} messageId={} payload={} error={}",
                message.queue(), message.messageId(), message.bodyAsString(), ex.toString(), ex);
            throw ex;
        }
    }
}
