package com.forecast.sync.conflict;

import com.forecast.sync.core.model.FieldValue;

import java.util.Objects;

/**
 * How to settle one conflicting field.
 *
 * @param manualValue the value to write for {@link Choice#MANUAL}, ignored otherwise
 */
public record FieldDecision(Choice choice, FieldValue manualValue) {

    public enum Choice {
        /** Write the locally intended value again. */
        KEEP_LOCAL,
        /** Accept the external system's value; the field is dropped from the delta. */
        KEEP_REMOTE,
        /** Write a value chosen by the resolver. */
        MANUAL
    }

    public FieldDecision {
        Objects.requireNonNull(choice, "choice is required");
        if (choice == Choice.MANUAL && manualValue == null) {
            throw new IllegalArgumentException("manualValue is required for MANUAL decisions");
        }
    }

    public static FieldDecision keepLocal() {
        return new FieldDecision(Choice.KEEP_LOCAL, null);
    }

    public static FieldDecision keepRemote() {
        return new FieldDecision(Choice.KEEP_REMOTE, null);
    }

    public static FieldDecision manual(Object value) {
        return new FieldDecision(Choice.MANUAL, FieldValue.of(value));
    }
}
