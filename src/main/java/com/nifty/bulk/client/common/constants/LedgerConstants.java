package com.nifty.bulk.client.common.constants;

import java.math.BigDecimal;

public interface LedgerConstants {

    BigDecimal MIN_TRANSACTION_AMOUNT = BigDecimal.ONE;          // coins
    BigDecimal MAX_TRANSACTION_AMOUNT = new BigDecimal("50000"); // coins

    String REASON_TRADE_BUY = "Trade Purchase";
    String REASON_TRADE_SELL = "Trade Sale";
    String REASON_PURCHASE = "Coin Purchase";
    String REASON_REFUND = "Trade Refund";
    String REASON_BONUS = "Bonus Coins";
    String REASON_ADJUSTMENT = "Balance Adjustment";
}
