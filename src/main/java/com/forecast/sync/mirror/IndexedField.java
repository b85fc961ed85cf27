package com.forecast.sync.mirror;

import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;

/**
 * Document fields that merged-view filters may reference. Only these names ever reach a query
 * as property names; filter values are always bound as parameters.
 */
public enum IndexedField {
    CATEGORY("category", false),
    EQUIPMENT_CLASS("class", false),
    SOURCE("source", false),
    DOR("dor", false),
    MANUFACTURER("manufacturer", true),
    MODEL("model", true);

    private final String fieldName;
    private final boolean searchable;

    IndexedField(String fieldName, boolean searchable) {
        this.fieldName = fieldName;
        this.searchable = searchable;
    }

    /**
     * Name of the field inside mirror documents.
     */
    public String fieldName() {
        return fieldName;
    }

    /**
     * Whether free-text search covers this field, in addition to the entity id.
     */
    public boolean searchable() {
        return searchable;
    }

    /**
     * Graph property holding the field's text form.
     */
    public String property() {
        return "f_" + fieldName;
    }

    /**
     * Text form of this field in the document, or null when absent or null.
     */
    public String textOf(Document document) {
        return document.get(fieldName).map(FieldValue::asText).orElse(null);
    }
}
