package com.narrativefeed.backend.common.exception;

import lombok.Getter;

/**
 * A single malformed or unprocessable content item. Reported per item, never fatal to a batch.
 */
@Getter
public class ItemProcessingException extends NarrativeFeedException {
    private static final String DEFAULT_ERROR_CODE = "ERR-ITEM-001";

    private final String itemId;

    public ItemProcessingException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public ItemProcessingException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
