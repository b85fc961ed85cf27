package com.forecast.sync.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable ordered mapping of field names to {@link FieldValue}s. Used for mirror snapshots,
 * overlay deltas and merged views.
 */
public final class Document {

    private static final Document EMPTY = new Document(new LinkedHashMap<>());

    private final Map<String, FieldValue> fields;

    private Document(LinkedHashMap<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Document empty() {
        return EMPTY;
    }

    /**
     * Creates a document from plain Java values, preserving iteration order of the input map.
     */
    public static Document of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values is required");
        LinkedHashMap<String, FieldValue> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(requireKey(key), FieldValue.of(value)));
        return new Document(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FieldValue> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public Map<String, FieldValue> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Shallow overlay: every key of {@code overlay} replaces the same key here, keys absent from
     * the overlay are kept. Nested structure is not merged recursively.
     */
    public Document overlay(Document overlay) {
        Objects.requireNonNull(overlay, "overlay is required");
        if (overlay.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, FieldValue> merged = new LinkedHashMap<>(fields);
        merged.putAll(overlay.fields);
        return new Document(merged);
    }

    /**
     * Returns a copy restricted to the given keys.
     */
    public Document select(Set<String> keys) {
        LinkedHashMap<String, FieldValue> selected = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (keys.contains(key)) {
                selected.put(key, value);
            }
        });
        return new Document(selected);
    }

    public Document without(String key) {
        if (!fields.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, FieldValue> copy = new LinkedHashMap<>(fields);
        copy.remove(key);
        return new Document(copy);
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document keys must be non-blank");
        }
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, FieldValue> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            fields.put(requireKey(key), FieldValue.of(value));
            return this;
        }

        public Builder putAll(Document other) {
            fields.putAll(other.fields);
            return this;
        }

        public Document build() {
            return new Document(new LinkedHashMap<>(fields));
        }
    }
}
