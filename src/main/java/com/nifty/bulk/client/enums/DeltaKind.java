package com.nifty.bulk.client.enums;

public enum DeltaKind {
    CREDIT,
    DEBIT
}
