package com.nifty.bulk.client.common.exception;

/**
 * A remote collaborator call failed (transport error or non-2xx status).
 */
public class GatewayException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-NET-001";

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
