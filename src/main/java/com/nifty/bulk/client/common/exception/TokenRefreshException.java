package com.nifty.bulk.client.common.exception;

/**
 * The bearer token could not be exchanged for a fresh one. Fatal to the session.
 */
public class TokenRefreshException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-004";

    public TokenRefreshException(String message) {
        super(message);
    }

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
