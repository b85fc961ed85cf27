package com.forecast.sync.sync;

import com.forecast.sync.core.model.Document;

import java.util.Objects;

/**
 * Outcome of pushing a delta to the external system.
 *
 * @param confirmedDocument the entity as stored remotely after a successful push, or null when
 *                          the remote side did not echo it
 * @param confirmedVersion  remote version after a successful push, or 0 when not echoed
 * @param errorCode         machine readable failure code, e.g. {@code RATE_LIMIT}
 */
public record PushResult(Outcome outcome, Document confirmedDocument, long confirmedVersion,
                         String errorCode, String message) {

    public enum Outcome {
        /** Applied remotely. */
        SUCCESS,
        /** Remote version no longer matches the expected base version. */
        CONFLICT,
        /** Retryable failure: network, rate limit or server error. */
        TRANSIENT_ERROR,
        /** Permanent rejection: retrying the same delta cannot succeed. */
        REJECTED
    }

    public PushResult {
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static PushResult success(Document confirmedDocument) {
        return success(confirmedDocument, 0);
    }

    public static PushResult success(Document confirmedDocument, long confirmedVersion) {
        return new PushResult(Outcome.SUCCESS, confirmedDocument, confirmedVersion, null, null);
    }

    public static PushResult conflict(String message) {
        return new PushResult(Outcome.CONFLICT, null, 0, "VERSION_CONFLICT", message);
    }

    public static PushResult transientError(String errorCode, String message) {
        return new PushResult(Outcome.TRANSIENT_ERROR, null, 0, errorCode, message);
    }

    public static PushResult rejected(String errorCode, String message) {
        return new PushResult(Outcome.REJECTED, null, 0, errorCode, message);
    }
}
