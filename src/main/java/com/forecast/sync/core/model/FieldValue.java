package com.forecast.sync.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A single value inside a {@link Document}. Values are restricted to a closed set of kinds so
 * documents stay comparable and serializable without reflection.
 */
public final class FieldValue {

    /**
     * The kinds of value a document field may hold.
     */
    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        TIMESTAMP,
        NULL
    }

    private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null);
    private static final FieldValue TRUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final FieldValue FALSE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static FieldValue ofString(String value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.STRING, value);
    }

    public static FieldValue ofNumber(BigDecimal value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.NUMBER, value);
    }

    public static FieldValue ofNumber(long value) {
        return new FieldValue(Kind.NUMBER, BigDecimal.valueOf(value));
    }

    public static FieldValue ofNumber(double value) {
        return new FieldValue(Kind.NUMBER, BigDecimal.valueOf(value));
    }

    public static FieldValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FieldValue ofTimestamp(Instant value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.TIMESTAMP, value);
    }

    public static FieldValue nullValue() {
        return NULL_VALUE;
    }

    /**
     * Converts a plain Java value into a field value.
     *
     * @throws IllegalArgumentException if the value's type is not one of the supported kinds
     */
    public static FieldValue of(Object raw) {
        if (raw == null) {
            return NULL_VALUE;
        }
        if (raw instanceof FieldValue fv) {
            return fv;
        }
        if (raw instanceof String s) {
            return ofString(s);
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof BigDecimal d) {
            return ofNumber(d);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ofNumber(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            return ofNumber(new BigDecimal(n.toString()));
        }
        if (raw instanceof Instant i) {
            return ofTimestamp(i);
        }
        throw new IllegalArgumentException("Unsupported field value type: " + raw.getClass().getName());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) value;
    }

    public BigDecimal asNumber() {
        requireKind(Kind.NUMBER);
        return (BigDecimal) value;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    public Instant asTimestamp() {
        requireKind(Kind.TIMESTAMP);
        return (Instant) value;
    }

    /**
     * Renders the value as text for search and indexing; null for {@link Kind#NULL}.
     */
    public String asText() {
        return switch (kind) {
            case NULL -> null;
            case NUMBER -> ((BigDecimal) value).toPlainString();
            default -> value.toString();
        };
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Field value is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        if (kind != other.kind) return false;
        if (kind == Kind.NUMBER) {
            return ((BigDecimal) value).compareTo((BigDecimal) other.value) == 0;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.NUMBER) {
            BigDecimal normalized = ((BigDecimal) value).stripTrailingZeros();
            return Objects.hash(kind, normalized.unscaledValue(), normalized.scale());
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }
}
