package com.nifty.bulk.client.test.service;

import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.PriceQuote;
import com.nifty.bulk.client.service.portfolio.PortfolioValuationEngine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PortfolioValuationEngineTest {

    private final PortfolioValuationEngine engine = new PortfolioValuationEngine();

    private static Position position(String sym, long qty, String avg) {
        return Position.builder().instrumentSymbol(sym).quantity(qty).averageCost(new BigDecimal(avg)).build();
    }

    private static PriceQuote quote(String sym, String price) {
        return PriceQuote.builder().instrumentSymbol(sym).price(new BigDecimal(price))
                .asOf(Instant.parse("2024-03-01T10:00:00Z")).build();
    }

    @Test
    void valuesSinglePositionAgainstQuote() {
        PortfolioValuation v = engine.revalue(List.of(position("RELIANCE", 10, "2450")),
                Map.of("RELIANCE", quote("RELIANCE", "2500")));

        Position p = v.getPositions().get(0);
        assertThat(p.getCurrentValue()).isEqualByComparingTo("25000");
        assertThat(p.getInvestedValue()).isEqualByComparingTo("24500");
        assertThat(p.getUnrealizedPnL()).isEqualByComparingTo("500");
        assertThat(p.getUnrealizedPnLPercent()).isEqualByComparingTo("2.04");
        assertThat(p.getCurrentQuote()).isEqualByComparingTo("2500");

        assertThat(v.getTotalInvestment()).isEqualByComparingTo("24500");
        assertThat(v.getTotalCurrentValue()).isEqualByComparingTo("25000");
        assertThat(v.getTotalPnL()).isEqualByComparingTo("500");
        assertThat(v.getTotalPnLPercent()).isEqualByComparingTo("2.04");
    }

    @Test
    void revaluingTwiceGivesTheSameResult() {
        List<Position> positions = List.of(position("RELIANCE", 10, "2450"), position("TCS", 3, "3800"));
        Map<String, PriceQuote> quotes = Map.of("RELIANCE", quote("RELIANCE", "2500"), "TCS", quote("TCS", "3700"));

        PortfolioValuation once = engine.revalue(positions, quotes);
        PortfolioValuation twice = engine.revalue(once.getPositions(), quotes);

        assertThat(twice).isEqualTo(once);
        assertThat(positions.get(0).getCurrentValue()).isNull(); // input untouched
    }

    @Test
    void missingQuoteFallsBackToLastKnownPrice() {
        Position held = position("INFY", 4, "1500").toBuilder().currentQuote(new BigDecimal("1550")).build();

        PortfolioValuation v = engine.revalue(List.of(held), Map.of());

        Position p = v.getPositions().get(0);
        assertThat(p.getCurrentQuote()).isEqualByComparingTo("1550");
        assertThat(p.getCurrentValue()).isEqualByComparingTo("6200");
        assertThat(p.getUnrealizedPnL()).isEqualByComparingTo("200");
    }

    @Test
    void positionWithNoPriceAtAllIsValuedAtCost() {
        PortfolioValuation v = engine.revalue(List.of(position("NEW", 2, "100")), null);

        assertThat(v.getTotalCurrentValue()).isEqualByComparingTo("200");
        assertThat(v.getTotalPnL()).isEqualByComparingTo("0");
        assertThat(v.getTotalPnLPercent()).isEqualByComparingTo("0");
    }

    @Test
    void zeroCostBasisGivesZeroPercent() {
        PortfolioValuation v = engine.revalue(List.of(position("FREE", 5, "0")), Map.of("FREE", quote("FREE", "10")));

        assertThat(v.getPositions().get(0).getUnrealizedPnL()).isEqualByComparingTo("50");
        assertThat(v.getPositions().get(0).getUnrealizedPnLPercent()).isEqualByComparingTo("0");
    }

    @Test
    void emptyBookIsEmptyValuation() {
        assertThat(engine.revalue(List.of(), Map.of())).isSameAs(PortfolioValuation.EMPTY);
    }
}
