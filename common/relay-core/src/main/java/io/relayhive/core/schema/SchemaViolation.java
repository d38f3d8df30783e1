package io.relayhive.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One failed schema rule.
 *
 * @param path JSON pointer of the offending value, rooted at {@code /message}
 * @param rule schema keyword that failed, for example {@code type} or {@code required}
 * @param message human readable description
 * @param value the offending value, or {@code null} when it is absent
 */
public record SchemaViolation(String path, String rule, String message, JsonNode value) {
}
