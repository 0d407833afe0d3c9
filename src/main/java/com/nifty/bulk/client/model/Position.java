package com.nifty.bulk.client.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One open holding. Quantity and average cost come from the journal; the valuation fields
 * (investedValue onwards) are only ever produced by a valuation pass.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String instrumentSymbol;
    long quantity;
    BigDecimal averageCost;
    BigDecimal currentQuote;      // last known market price

    BigDecimal investedValue;
    BigDecimal currentValue;
    BigDecimal unrealizedPnL;
    BigDecimal unrealizedPnLPercent;

    Instant openedAt;
}
