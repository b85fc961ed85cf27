package com.forecast.sync.archival;

/**
 * Cold storage could not store or read an archive. A batch whose archive failed is not deleted.
 */
public class ArchivalException extends RuntimeException {

    public ArchivalException(String message) {
        super(message);
    }

    public ArchivalException(String message, Throwable cause) {
        super(message, cause);
    }
}
