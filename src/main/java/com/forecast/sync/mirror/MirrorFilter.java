package com.forecast.sync.mirror;

import com.forecast.sync.core.model.MirrorRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Predicate over mirror rows: exact matches on {@link IndexedField}s plus an optional
 * case-insensitive substring search across the entity id and the searchable fields.
 *
 * @param exactMatches field to required text value
 * @param search       search term, or null
 */
public record MirrorFilter(Map<IndexedField, String> exactMatches, String search) {

    public MirrorFilter {
        EnumMap<IndexedField, String> copy = new EnumMap<>(IndexedField.class);
        if (exactMatches != null) {
            exactMatches.forEach((field, value) -> {
                if (value != null) {
                    copy.put(field, value);
                }
            });
        }
        exactMatches = Collections.unmodifiableMap(copy);
        search = search == null || search.isBlank() ? null : search.trim().toLowerCase(Locale.ROOT);
    }

    public static MirrorFilter none() {
        return new MirrorFilter(Map.of(), null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return exactMatches.isEmpty() && search == null;
    }

    public boolean matches(MirrorRecord mirror) {
        for (Map.Entry<IndexedField, String> match : exactMatches.entrySet()) {
            if (!match.getValue().equals(match.getKey().textOf(mirror.document()))) {
                return false;
            }
        }
        return search == null || matchesSearch(mirror);
    }

    private boolean matchesSearch(MirrorRecord mirror) {
        if (contains(mirror.entityId())) {
            return true;
        }
        for (IndexedField field : IndexedField.values()) {
            if (field.searchable() && contains(field.textOf(mirror.document()))) {
                return true;
            }
        }
        return false;
    }

    private boolean contains(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(search);
    }

    public static class Builder {
        private final EnumMap<IndexedField, String> exactMatches = new EnumMap<>(IndexedField.class);
        private String search;

        public Builder equalTo(IndexedField field, String value) {
            exactMatches.put(field, value);
            return this;
        }

        public Builder category(String category) { return equalTo(IndexedField.CATEGORY, category); }
        public Builder equipmentClass(String equipmentClass) { return equalTo(IndexedField.EQUIPMENT_CLASS, equipmentClass); }
        public Builder source(String source) { return equalTo(IndexedField.SOURCE, source); }
        public Builder dor(String dor) { return equalTo(IndexedField.DOR, dor); }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public MirrorFilter build() {
            return new MirrorFilter(exactMatches, search);
        }
    }
}
