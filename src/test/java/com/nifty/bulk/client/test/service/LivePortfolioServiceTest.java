package com.nifty.bulk.client.test.service;

import com.nifty.bulk.client.config.CustomConfig;
import com.nifty.bulk.client.core.InMemoryStateStore;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.PriceQuote;
import com.nifty.bulk.client.model.Transaction;
import com.nifty.bulk.client.service.feed.PriceFeedSubscriber;
import com.nifty.bulk.client.service.gateway.InProcessPriceFeed;
import com.nifty.bulk.client.service.portfolio.LivePortfolioService;
import com.nifty.bulk.client.service.portfolio.PortfolioValuationEngine;
import com.nifty.bulk.client.service.portfolio.PositionBook;
import com.nifty.bulk.client.service.streaming.StreamGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LivePortfolioServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InProcessPriceFeed connection;
    private PositionBook book;
    private StreamGateway stream;
    private LivePortfolioService live;

    @BeforeEach
    void setUp() {
        connection = new InProcessPriceFeed();
        PriceFeedSubscriber feed = new PriceFeedSubscriber(connection);
        feed.open();
        book = new PositionBook(new InMemoryStateStore(), new CustomConfig().mapper());
        book.load("u1");
        stream = mock(StreamGateway.class);
        live = new LivePortfolioService(book, feed, new PortfolioValuationEngine(), stream);
    }

    private void buy(String sym, long qty, String price) {
        BigDecimal p = new BigDecimal(price);
        book.record(Transaction.builder().id(sym + qty).kind(TransactionKind.BUY).instrumentSymbol(sym)
                .quantity(qty).price(p).amount(p.multiply(BigDecimal.valueOf(qty))).timestamp(T0).build());
    }

    private void tick(String sym, String price, Instant at) {
        connection.publish(PriceQuote.builder().instrumentSymbol(sym).price(new BigDecimal(price)).asOf(at).build());
    }

    @Test
    void tickRevaluesHeldPosition() {
        buy("RELIANCE", 10, "2450");
        live.start();
        assertThat(connection.isSubscribed("RELIANCE")).isTrue();

        tick("RELIANCE", "2500", T0.plusSeconds(1));

        PortfolioValuation v = live.current();
        assertThat(v.getTotalCurrentValue()).isEqualByComparingTo("25000");
        assertThat(v.getTotalPnL()).isEqualByComparingTo("500");
        verify(stream, atLeastOnce()).send(eq(LivePortfolioService.TOPIC), any(PortfolioValuation.class));
    }

    @Test
    void newPositionIsSubscribedAfterChange() {
        live.start();
        assertThat(connection.isSubscribed("TCS")).isFalse();

        buy("TCS", 2, "3800");
        PortfolioValuation v = live.positionsChanged();

        assertThat(connection.isSubscribed("TCS")).isTrue();
        assertThat(v.getTotalInvestment()).isEqualByComparingTo("7600");
    }

    @Test
    void lastKnownQuoteSurvivesFeedGap() {
        buy("INFY", 4, "1500");
        live.start();
        tick("INFY", "1550", T0.plusSeconds(1));

        buy("INFY", 1, "1500");
        // no new tick: the last quote seen still prices the position
        PortfolioValuation v = live.positionsChanged();
        assertThat(v.getPositions().get(0).getQuantity()).isEqualTo(5);
        assertThat(v.getPositions().get(0).getCurrentQuote()).isEqualByComparingTo("1550");
    }

    @Test
    void stopReleasesFeedAndResetsValuation() {
        buy("SBIN", 1, "600");
        live.start();

        live.stop();

        assertThat(connection.isSubscribed("SBIN")).isFalse();
        assertThat(live.current()).isSameAs(PortfolioValuation.EMPTY);
    }
}
