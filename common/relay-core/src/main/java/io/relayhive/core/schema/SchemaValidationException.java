package io.relayhive.core.schema;

import io.relayhive.core.RelayException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an envelope payload does not satisfy the processor's JSON schema.
 */
public class SchemaValidationException extends RelayException {

    private final List<SchemaViolation> violations;

    public SchemaValidationException(List<SchemaViolation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }

    private static String describe(List<SchemaViolation> violations) {
        return "Message validation failed against schema: " + violations.stream()
            .map(v -> v.path() + " [" + v.rule() + "]")
            .collect(Collectors.joining(", "));
    }
}
