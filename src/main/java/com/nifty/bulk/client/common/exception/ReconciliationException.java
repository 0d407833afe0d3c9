package com.nifty.bulk.client.common.exception;

/**
 * An authoritative ledger pull failed or returned an unusable snapshot.
 * Transient: the cached balance is kept and the pull retried on the next tick.
 */
public class ReconciliationException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-REC-001";

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
