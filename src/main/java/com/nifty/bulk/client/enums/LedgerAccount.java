package com.nifty.bulk.client.enums;

/**
 * The two cached amounts: wallet currency and the reward currency ("coins").
 */
public enum LedgerAccount {
    WALLET,
    REWARD
}
