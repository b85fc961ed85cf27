package com.forecast.sync.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a delta is rejected by the {@link ValidationGate}. Nothing is persisted.
 */
public class ValidationException extends RuntimeException {

    private final String entityId;
    private final List<FieldError> errors;

    public ValidationException(String entityId, List<FieldError> errors) {
        super("Validation failed for " + entityId + ": " + errors.stream()
                .map(e -> e.field() + " " + e.code())
                .collect(Collectors.joining(", ")));
        this.entityId = entityId;
        this.errors = List.copyOf(errors);
    }

    public String getEntityId() {
        return entityId;
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
