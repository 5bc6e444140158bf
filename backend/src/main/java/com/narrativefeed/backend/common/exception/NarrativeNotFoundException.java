package com.narrativefeed.backend.common.exception;

public class NarrativeNotFoundException extends NarrativeFeedException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NF-001";

    public NarrativeNotFoundException(Long narrativeId) {
        super("Narrative not found: " + narrativeId);
    }

    public NarrativeNotFoundException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
