package com.narrativefeed.backend.common.exception;

import lombok.Getter;

/**
 * Base exception for the narrative pipeline. Carries a stable error code next to the message.
 */
@Getter
public abstract class NarrativeFeedException extends RuntimeException {

    private final String errorCode;

    protected NarrativeFeedException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected NarrativeFeedException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected NarrativeFeedException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass provides the code used when none is given explicitly.
     */
    protected abstract String getDefaultErrorCode();
}
