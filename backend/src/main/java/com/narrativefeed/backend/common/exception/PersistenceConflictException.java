package com.narrativefeed.backend.common.exception;

/**
 * A write collided with an existing row holding different content.
 */
public class PersistenceConflictException extends NarrativeFeedException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-409";

    public PersistenceConflictException(String message) {
        super(message);
    }

    public PersistenceConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
