package com.nifty.bulk.client.common.exception;

/**
 * Exception for malformed input (non-positive amounts, blank symbols and the like).
 */
public class ValidationException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
