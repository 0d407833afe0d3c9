package com.nifty.bulk.client.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Result of one valuation pass: revalued positions plus the aggregates derived from them.
 */
@Value
public class PortfolioValuation {

    public static final PortfolioValuation EMPTY = new PortfolioValuation(
            Collections.emptyList(), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    List<Position> positions;
    BigDecimal totalInvestment;
    BigDecimal totalCurrentValue;
    BigDecimal totalPnL;
    BigDecimal totalPnLPercent;
}
