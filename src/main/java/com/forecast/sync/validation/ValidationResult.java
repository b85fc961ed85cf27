package com.forecast.sync.validation;

import java.util.List;

/**
 * Outcome of a {@link ValidationGate} check.
 */
public record ValidationResult(List<FieldError> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<FieldError> errors) {
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
