package com.forecast.sync.validation;

import com.forecast.sync.core.model.Document;

/**
 * Pass/fail check applied to a delta before it is saved as a draft or committed.
 */
public interface ValidationGate {

    ValidationResult validate(Document delta);

    /**
     * A gate that accepts every delta.
     */
    static ValidationGate acceptAll() {
        return delta -> ValidationResult.valid();
    }
}
