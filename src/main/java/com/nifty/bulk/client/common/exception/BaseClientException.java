package com.nifty.bulk.client.common.exception;

import lombok.Getter;

/**
 * Base exception class for all client engine exceptions.
 * Carries an error code that survives the trip through {@code Result} and the HTTP layer.
 */
@Getter
public abstract class BaseClientException extends RuntimeException {

    private final String errorCode;

    protected BaseClientException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseClientException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
