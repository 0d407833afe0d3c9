package com.nifty.bulk.client.common.exception;

/**
 * Credentials were rejected by the authentication endpoint. The existing session, if any,
 * is left untouched.
 */
public class AuthFailureException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-001";

    public AuthFailureException(String message) {
        super(message);
    }

    public AuthFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
