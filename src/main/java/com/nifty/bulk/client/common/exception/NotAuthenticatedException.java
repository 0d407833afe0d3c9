package com.nifty.bulk.client.common.exception;

public class NotAuthenticatedException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-003";

    public NotAuthenticatedException() {
        super("No active session");
    }

    public NotAuthenticatedException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
