package com.forecast.sync.validation;

/**
 * A single rejected field.
 *
 * @param field   field name
 * @param message human readable reason
 * @param code    machine readable reason, e.g. {@code INVALID_DATE_ORDER}
 */
public record FieldError(String field, String message, String code) {
}
