package com.nifty.bulk.client.common.exception;

/**
 * Another login claimed the active-session slot (fencing token mismatch). Fatal to the session.
 */
public class ConcurrentSessionException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-005";

    public ConcurrentSessionException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
