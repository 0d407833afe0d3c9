package com.nifty.bulk.client.core;

/**
 * Raised when the backing store cannot be read or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
