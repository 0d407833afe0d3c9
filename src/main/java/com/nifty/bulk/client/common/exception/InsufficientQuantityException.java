package com.nifty.bulk.client.common.exception;

public class InsufficientQuantityException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BAL-002";

    public InsufficientQuantityException(String symbol, long held, long requested) {
        super(String.format("Insufficient quantity of %s: held %d, requested %d", symbol, held, requested));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
