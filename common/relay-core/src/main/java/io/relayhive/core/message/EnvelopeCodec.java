package io.relayhive.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.relayhive.core.message.MessageDeserializationException.Reason;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JSON codec for {@link Envelope}s.
 * <p>
 * Decoding happens in two steps so the raw {@code message} tree can be schema-validated before
 * it is bound to a Java type: {@link #decodeTree(byte[])} checks the envelope structure and
 * {@link #bind(Envelope, JavaType)} converts the payload. Either step fails with a
 * {@link MessageDeserializationException}; a partially decoded envelope is never returned.
 */
public class EnvelopeCodec {

    private final ObjectMapper json;
    private final ObjectReader treeReader;

    public EnvelopeCodec(ObjectMapper json) {
        this.json = Objects.requireNonNull(json, "json");
        this.treeReader = json.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper objectMapper() {
        return json;
    }

    public byte[] encode(Envelope<?> envelope) throws JsonProcessingException {
        Objects.requireNonNull(envelope, "envelope");
        return json.writeValueAsBytes(envelope);
    }

    public <T> Envelope<T> decode(byte[] body, Class<T> payloadType) {
        Objects.requireNonNull(payloadType, "payloadType");
        return bind(decodeTree(body), json.constructType(payloadType));
    }

    public Envelope<JsonNode> decodeTree(byte[] body) {
        if (body == null || body.length == 0 || new String(body, StandardCharsets.UTF_8).isBlank()) {
            throw new MessageDeserializationException(Reason.EMPTY_BODY, "Message body is empty");
        }
        JsonNode root;
        try {
            root = treeReader.readTree(body);
        } catch (IOException ex) {
            String detail = ex instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : ex.getMessage();
            throw new MessageDeserializationException(Reason.MALFORMED_JSON, "Failed to parse JSON: " + detail, ex);
        }
        if (root == null || !root.isObject()) {
            throw invalid("body is not a JSON object");
        }
        JsonNode message = root.get("message");
        if (message == null || !message.isObject()) {
            throw invalid("'message' must be a JSON object");
        }
        JsonNode meta = root.get("meta");
        if (meta == null || !meta.isObject()) {
            throw invalid("'meta' must be a JSON object");
        }
        JsonNode id = meta.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw invalid("'meta.id' must be a non-empty string");
        }
        JsonNode publishedAt = meta.get("publishedAt");
        if (publishedAt == null || !publishedAt.isIntegralNumber() || !publishedAt.canConvertToLong()) {
            throw invalid("'meta.publishedAt' must be an epoch-millis integer");
        }
        return new Envelope<>(message, new EnvelopeMeta(id.asText(), publishedAt.longValue()));
    }

    public <T> Envelope<T> bind(Envelope<JsonNode> tree, JavaType payloadType) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(payloadType, "payloadType");
        T payload;
        try {
            payload = json.readerFor(payloadType).readValue(tree.message());
        } catch (IOException | IllegalArgumentException ex) {
            throw new MessageDeserializationException(Reason.PAYLOAD_MISMATCH,
                "Message cannot be read as " + payloadType.toCanonical() + ": " + ex.getMessage(), ex);
        }
        if (payload == null) {
            throw new MessageDeserializationException(Reason.PAYLOAD_MISMATCH,
                "Message decoded to null for " + payloadType.toCanonical());
        }
        return new Envelope<>(payload, tree.meta());
    }

    private static MessageDeserializationException invalid(String detail) {
        return new MessageDeserializationException(Reason.INVALID_ENVELOPE, "Invalid envelope: " + detail);
    }
}
