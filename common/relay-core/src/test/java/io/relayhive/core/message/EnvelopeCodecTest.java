package io.relayhive.core.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relayhive.core.message.MessageDeserializationException.Reason;
import io.relayhive.core.testing.Deliveries;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EnvelopeCodecTest {

    private final ObjectMapper json = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(json);

    record Order(String orderId, int quantity, List<String> tags) {
    }

    @Test
    void encodesMessageAndMeta() throws Exception {
        Envelope<Order> envelope = new Envelope<>(new Order("o-1", 2, List.of("a")), new EnvelopeMeta("id-1", 1700L));

        JsonNode tree = json.readTree(codec.encode(envelope));

        assertThat(tree.get("message").get("orderId").asText()).isEqualTo("o-1");
        assertThat(tree.get("meta").get("id").asText()).isEqualTo("id-1");
        assertThat(tree.get("meta").get("publishedAt").asLong()).isEqualTo(1700L);
    }

    @Test
    void decodesWhatItEncodes() throws Exception {
        Envelope<Order> envelope = new Envelope<>(new Order("o-1", 2, List.of("a", "b")), new EnvelopeMeta("id-1", 1700L));

        Envelope<Order> decoded = codec.decode(codec.encode(envelope), Order.class);

        assertThat(decoded).isEqualTo(envelope);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n"})
    void rejectsEmptyBody(String body) {
        assertReason(body, Reason.EMPTY_BODY);
    }

    @Test
    void rejectsNullBody() {
        assertThatThrownBy(() -> codec.decodeTree(null))
            .isInstanceOfSatisfying(MessageDeserializationException.class,
                ex -> assertThat(ex.reason()).isEqualTo(Reason.EMPTY_BODY));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{\"message\":", "{} trailing"})
    void rejectsMalformedJson(String body) {
        assertReason(body, Reason.MALFORMED_JSON);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[1,2]",
        "\"text\"",
        "{\"meta\":{\"id\":\"a\",\"publishedAt\":1}}",
        "{\"message\":null,\"meta\":{\"id\":\"a\",\"publishedAt\":1}}",
        "{\"message\":[1],\"meta\":{\"id\":\"a\",\"publishedAt\":1}}",
        "{\"message\":{}}",
        "{\"message\":{},\"meta\":{\"publishedAt\":1}}",
        "{\"message\":{},\"meta\":{\"id\":7,\"publishedAt\":1}}",
        "{\"message\":{},\"meta\":{\"id\":\"\",\"publishedAt\":1}}",
        "{\"message\":{},\"meta\":{\"id\":\"a\"}}",
        "{\"message\":{},\"meta\":{\"id\":\"a\",\"publishedAt\":\"yesterday\"}}",
        "{\"message\":{},\"meta\":{\"id\":\"a\",\"publishedAt\":1.5}}"
    })
    void rejectsStructurallyInvalidEnvelope(String body) {
        assertReason(body, Reason.INVALID_ENVELOPE);
    }

    @Test
    void rejectsPayloadThatDoesNotBindToType() {
        String body = Deliveries.envelopeJson("{\"orderId\":\"o-1\",\"quantity\":\"many\"}", "id-1", 1L);

        assertThatThrownBy(() -> codec.decode(body.getBytes(StandardCharsets.UTF_8), Order.class))
            .isInstanceOfSatisfying(MessageDeserializationException.class,
                ex -> assertThat(ex.reason()).isEqualTo(Reason.PAYLOAD_MISMATCH));
    }

    @Test
    void decodeTreeKeepsRawMessage() {
        String body = Deliveries.envelopeJson("{\"field1\":123}", "id-9", 99L);

        Envelope<JsonNode> tree = codec.decodeTree(body.getBytes(StandardCharsets.UTF_8));

        assertThat(tree.message().get("field1").isInt()).isTrue();
        assertThat(tree.meta()).isEqualTo(new EnvelopeMeta("id-9", 99L));
    }

    private void assertReason(String body, Reason reason) {
        assertThatThrownBy(() -> codec.decodeTree(body.getBytes(StandardCharsets.UTF_8)))
            .isInstanceOfSatisfying(MessageDeserializationException.class,
                ex -> assertThat(ex.reason()).isEqualTo(reason));
    }
}
