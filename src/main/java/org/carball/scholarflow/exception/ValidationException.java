package org.carball.scholarflow.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Malformed or out-of-range input. Violations are keyed by the offending field name.
 */
@Getter
public class ValidationException extends WorkflowException {

    private final Map<String, String> violations;

    public ValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    public ValidationException(Map<String, String> violations) {
        super("VALIDATION_ERROR", describe(violations));
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    private static String describe(Map<String, String> violations) {
        return violations.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; ", "Validation failed - ", ""));
    }
}
