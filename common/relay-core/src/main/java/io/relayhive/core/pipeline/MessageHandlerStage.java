package io.relayhive.core.pipeline;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.relayhive.core.message.Envelope;
import io.relayhive.core.message.EnvelopeCodec;
import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.schema.MessageSchemaValidator;
import java.util.Objects;

/**
 * Terminal stage: decodes the envelope, validates the payload, binds it and calls the handler.
 * <p>
 * Decoding and validation failures propagate as they are; anything the handler throws is
 * wrapped in a {@link MessageProcessingException}.
 */
public final class MessageHandlerStage<T> implements ProcessingStage {

    private final EnvelopeCodec codec;
    private final JavaType payloadType;
    private final MessageSchemaValidator validator;
    private final MessageHandler<T> handler;

    public MessageHandlerStage(EnvelopeCodec codec,
                               JavaType payloadType,
                               MessageSchemaValidator validator,
                               MessageHandler<T> handler) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        this.validator = validator;
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public boolean process(InboundMessage message, Chain chain) {
        Envelope<JsonNode> tree = codec.decodeTree(message.body());
        if (validator != null) {
            validator.validate(tree.message());
        }
        Envelope<T> envelope = codec.bind(tree, payloadType);
        try {
            handler.handle(envelope);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MessageProcessingException("Handler interrupted for message " + envelope.meta().id(), ex);
        } catch (Exception ex) {
            throw new MessageProcessingException("Handler failed for message " + envelope.meta().id()
                + " on queue " + message.queue() + ": " + ex.getMessage(), ex);
        }
        return true;
    }
}
