package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.LedgerAccount;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceCheck {
    LedgerAccount account;
    BigDecimal currentBalance;
    BigDecimal requiredAmount;
    boolean sufficient;

    public BigDecimal getShortfall() {
        return sufficient ? BigDecimal.ZERO : requiredAmount.subtract(currentBalance);
    }
}
