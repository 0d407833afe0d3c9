package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TradeOrder {
    String userId;
    String symbol;
    TransactionKind type; // BUY or SELL
    long quantity;
    BigDecimal price;
    BigDecimal total;
    Instant timestamp;
}
