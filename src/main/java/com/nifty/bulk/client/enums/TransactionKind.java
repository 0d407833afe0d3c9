package com.nifty.bulk.client.enums;

public enum TransactionKind {
    BUY,
    SELL,
    CREDIT,
    DEBIT;

    public boolean isTrade() {
        return this == BUY || this == SELL;
    }
}
