package com.forecast.sync.sync;

/**
 * A retryable failure talking to the external system.
 */
public class TransientSyncException extends RuntimeException {

    private final String errorCode;

    public TransientSyncException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TransientSyncException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
