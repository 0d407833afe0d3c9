package com.nifty.bulk.client.common.exception;

import com.nifty.bulk.client.enums.LedgerAccount;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * A debit would drive a ledger amount below zero. Raised before anything is mutated.
 */
@Getter
public class InsufficientBalanceException extends BaseClientException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BAL-001";

    private final LedgerAccount account;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientBalanceException(LedgerAccount account, BigDecimal available, BigDecimal required) {
        super(String.format("Insufficient %s balance: available %s, required %s",
                account.name().toLowerCase(), available.toPlainString(), required.toPlainString()));
        this.account = account;
        this.available = available;
        this.required = required;
    }

    public BigDecimal getShortfall() {
        return required.subtract(available);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
