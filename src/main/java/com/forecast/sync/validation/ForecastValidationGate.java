package com.forecast.sync.validation;

import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Field rules for equipment forecast deltas: date ordering, enumerations, cost ranges and the
 * cost field each source type requires.
 */
public class ForecastValidationGate implements ValidationGate {
    private static final Logger log = LoggerFactory.getLogger(ForecastValidationGate.class);

    public static final String INVALID_DATE_ORDER = "INVALID_DATE_ORDER";
    public static final String MISSING_REQUIRED_FIELD = "MISSING_REQUIRED_FIELD";
    public static final String INVALID_ENUM_VALUE = "INVALID_ENUM_VALUE";
    public static final String INVALID_RANGE = "INVALID_RANGE";
    public static final String INVALID_TYPE = "INVALID_TYPE";

    private static final List<String[]> DATE_RANGES = List.of(
            new String[]{"forecastStart", "forecastEnd", "Forecast"},
            new String[]{"originalStart", "originalEnd", "Original"},
            new String[]{"actualStart", "actualEnd", "Actual"});
    private static final Set<String> SOURCES = Set.of("Rental", "Purchase");
    private static final Set<String> DORS = Set.of("BEO", "PROJECT");
    private static final List<String> COST_FIELDS = List.of("monthlyRate", "purchasePrice");
    private static final List<String> FLAG_FIELDS = List.of(
            "isActualized", "isDiscontinued", "isFundsTransferable", "hasPlan", "hasActuals");

    @Override
    public ValidationResult validate(Document delta) {
        List<FieldError> errors = new ArrayList<>();

        for (String[] range : DATE_RANGES) {
            checkDateOrder(delta, range[0], range[1], range[2], errors);
        }

        String source = text(delta, "source");
        if (source != null && !SOURCES.contains(source)) {
            errors.add(new FieldError("source", "Source must be either Rental or Purchase", INVALID_ENUM_VALUE));
        }
        String dor = text(delta, "dor");
        if (dor != null && !DORS.contains(dor)) {
            errors.add(new FieldError("dor", "DOR must be either BEO or PROJECT", INVALID_ENUM_VALUE));
        }

        if ("Rental".equals(source)) {
            requirePresent(delta, "monthlyRate", "Monthly rate is required for rental equipment", errors);
        }
        if ("Purchase".equals(source)) {
            requirePresent(delta, "purchasePrice", "Purchase price is required for purchased equipment", errors);
        }

        for (String field : COST_FIELDS) {
            checkNonNegative(delta, field, errors);
        }

        for (String field : FLAG_FIELDS) {
            delta.get(field).ifPresent(value -> {
                if (value.kind() != FieldValue.Kind.BOOLEAN) {
                    errors.add(new FieldError(field, field + " must be a boolean", INVALID_TYPE));
                }
            });
        }

        if (errors.isEmpty()) {
            log.debug("validation.passed fields={}", delta.keys());
            return ValidationResult.valid();
        }
        log.warn("validation.failed errors={}", errors.stream().map(e -> e.field() + ":" + e.code()).toList());
        return ValidationResult.invalid(errors);
    }

    private static void checkDateOrder(Document delta, String startField, String endField, String label,
                                       List<FieldError> errors) {
        Optional<Instant> start = date(delta, startField, errors);
        Optional<Instant> end = date(delta, endField, errors);
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            errors.add(new FieldError(endField, label + " end date must be after start date", INVALID_DATE_ORDER));
        }
    }

    private static Optional<Instant> date(Document delta, String field, List<FieldError> errors) {
        Optional<FieldValue> value = delta.get(field).filter(v -> !v.isNull());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        FieldValue v = value.get();
        if (v.kind() == FieldValue.Kind.TIMESTAMP) {
            return Optional.of(v.asTimestamp());
        }
        if (v.kind() == FieldValue.Kind.STRING) {
            try {
                return Optional.of(parseDate(v.asString()));
            } catch (DateTimeParseException e) {
                errors.add(new FieldError(field, field + " is not a valid date", INVALID_TYPE));
                return Optional.empty();
            }
        }
        errors.add(new FieldError(field, field + " must be a date", INVALID_TYPE));
        return Optional.empty();
    }

    private static Instant parseDate(String text) {
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return Instant.parse(text);
    }

    private static void requirePresent(Document delta, String field, String message, List<FieldError> errors) {
        if (delta.get(field).filter(v -> !v.isNull()).isEmpty()) {
            errors.add(new FieldError(field, message, MISSING_REQUIRED_FIELD));
        }
    }

    private static void checkNonNegative(Document delta, String field, List<FieldError> errors) {
        delta.get(field).filter(v -> !v.isNull()).ifPresent(value -> {
            if (value.kind() != FieldValue.Kind.NUMBER) {
                errors.add(new FieldError(field, field + " must be a number", INVALID_TYPE));
            } else if (value.asNumber().compareTo(BigDecimal.ZERO) < 0) {
                errors.add(new FieldError(field, field + " must be non-negative", INVALID_RANGE));
            }
        });
    }

    private static String text(Document delta, String field) {
        return delta.get(field)
                .filter(v -> v.kind() == FieldValue.Kind.STRING)
                .map(FieldValue::asString)
                .orElse(null);
    }
}
