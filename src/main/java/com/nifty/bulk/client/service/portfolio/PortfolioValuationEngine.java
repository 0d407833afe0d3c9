package com.nifty.bulk.client.service.portfolio;

import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.PriceQuote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure valuation pass: positions plus quotes in, revalued positions and aggregates out.
 * Nothing is mutated, so running it twice on the same input yields the same output.
 */
@Component
public class PortfolioValuationEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PortfolioValuation revalue(Collection<Position> positions, Map<String, PriceQuote> quotes) {
        if (positions == null || positions.isEmpty()) {
            return PortfolioValuation.EMPTY;
        }
        Map<String, PriceQuote> q = quotes == null ? Collections.emptyMap() : quotes;

        List<Position> out = new ArrayList<>(positions.size());
        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal current = BigDecimal.ZERO;
        for (Position p : positions) {
            Position v = revalueOne(p, quoteFor(q, p.getInstrumentSymbol()));
            out.add(v);
            invested = invested.add(v.getInvestedValue());
            current = current.add(v.getCurrentValue());
        }
        BigDecimal pnl = current.subtract(invested);
        return new PortfolioValuation(Collections.unmodifiableList(out), invested, current, pnl, percent(pnl, invested));
    }

    Position revalueOne(Position p, PriceQuote quote) {
        BigDecimal qty = BigDecimal.valueOf(p.getQuantity());
        BigDecimal avg = p.getAverageCost() == null ? BigDecimal.ZERO : p.getAverageCost();
        BigDecimal invested = qty.multiply(avg);

        BigDecimal price;
        BigDecimal currentValue;
        if (quote != null && quote.getPrice() != null) {
            price = quote.getPrice();
            currentValue = qty.multiply(price);
        } else if (p.getCurrentQuote() != null) {
            // feed gap: last-known quote
            price = p.getCurrentQuote();
            currentValue = qty.multiply(price);
        } else {
            price = null;
            currentValue = p.getCurrentValue() != null ? p.getCurrentValue() : invested;
        }

        BigDecimal pnl = currentValue.subtract(invested);
        return p.toBuilder()
                .currentQuote(price)
                .investedValue(invested)
                .currentValue(currentValue)
                .unrealizedPnL(pnl)
                .unrealizedPnLPercent(percent(pnl, invested))
                .build();
    }

    static BigDecimal percent(BigDecimal pnl, BigDecimal invested) {
        if (invested.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return pnl.divide(invested, 6, RoundingMode.HALF_UP).multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP);
    }

    private static PriceQuote quoteFor(Map<String, PriceQuote> quotes, String symbol) {
        if (symbol == null) return null;
        PriceQuote exact = quotes.get(symbol);
        return exact != null ? exact : quotes.get(symbol.toUpperCase(Locale.ROOT));
    }
}
