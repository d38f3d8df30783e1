package io.relayhive.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.PathType;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates envelope payloads against a JSON schema (draft 2020-12 unless the schema declares
 * another {@code $schema}).
 * <p>
 * The schema is compiled once at construction; instances are thread-safe and shared by every
 * worker of a processor.
 */
public final class MessageSchemaValidator {

    static final String MESSAGE_ROOT = "/message";

    private final JsonSchema schema;

    public MessageSchemaValidator(JsonNode schemaNode) {
        Objects.requireNonNull(schemaNode, "schemaNode");
        SchemaValidatorsConfig config = new SchemaValidatorsConfig();
        config.setPathType(PathType.JSON_POINTER);
        try {
            this.schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012)
                .getSchema(schemaNode, config);
            this.schema.initializeValidators();
        } catch (JsonSchemaException ex) {
            throw new IllegalArgumentException("Invalid message schema: " + ex.getMessage(), ex);
        }
    }

    /**
     * @throws SchemaValidationException listing every violation when {@code message} is invalid
     */
    public void validate(JsonNode message) {
        Objects.requireNonNull(message, "message");
        Set<ValidationMessage> errors = schema.validate(message);
        if (errors.isEmpty()) {
            return;
        }
        List<SchemaViolation> violations = new ArrayList<>(errors.size());
        for (ValidationMessage error : errors) {
            String pointer = error.getInstanceLocation() == null ? "" : error.getInstanceLocation().toString();
            JsonNode value = message.at(pointer);
            violations.add(new SchemaViolation(
                MESSAGE_ROOT + pointer,
                error.getType(),
                error.getMessage(),
                value.isMissingNode() ? null : value));
        }
        throw new SchemaValidationException(violations);
    }
}
