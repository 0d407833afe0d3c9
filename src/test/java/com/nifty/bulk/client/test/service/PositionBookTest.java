package com.nifty.bulk.client.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.common.exception.InsufficientQuantityException;
import com.nifty.bulk.client.common.exception.ValidationException;
import com.nifty.bulk.client.config.CustomConfig;
import com.nifty.bulk.client.core.InMemoryStateStore;
import com.nifty.bulk.client.core.StateStore;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.Transaction;
import com.nifty.bulk.client.service.portfolio.PositionBook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionBookTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final ObjectMapper mapper = new CustomConfig().mapper();
    private StateStore store;
    private PositionBook book;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        book = new PositionBook(store, mapper);
        book.load("u1");
    }

    private static Transaction trade(TransactionKind kind, String sym, long qty, String price, Instant at) {
        BigDecimal p = new BigDecimal(price);
        return Transaction.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .instrumentSymbol(sym)
                .quantity(qty)
                .price(p)
                .amount(p.multiply(BigDecimal.valueOf(qty)))
                .timestamp(at)
                .build();
    }

    @Test
    void secondBuyRecomputesWeightedAverage() {
        book.record(trade(TransactionKind.BUY, "TCS", 5, "100", T0));
        book.record(trade(TransactionKind.BUY, "TCS", 5, "120", T0.plusSeconds(60)));

        Position p = book.position("TCS").orElseThrow();
        assertThat(p.getQuantity()).isEqualTo(10);
        assertThat(p.getAverageCost()).isEqualByComparingTo("110");
        assertThat(p.getOpenedAt()).isEqualTo(T0);
    }

    @Test
    void partialSellDecrementsAndFullSellCloses() {
        book.record(trade(TransactionKind.BUY, "INFY", 10, "1500", T0));

        book.record(trade(TransactionKind.SELL, "INFY", 4, "1550", T0.plusSeconds(1)));
        assertThat(book.position("INFY").orElseThrow().getQuantity()).isEqualTo(6);
        assertThat(book.position("INFY").orElseThrow().getAverageCost()).isEqualByComparingTo("1500");

        book.record(trade(TransactionKind.SELL, "INFY", 6, "1560", T0.plusSeconds(2)));
        assertThat(book.position("INFY")).isEmpty();
        assertThat(book.transactions()).hasSize(3);
    }

    @Test
    void oversellIsRejectedWithoutJournalEntry() {
        book.record(trade(TransactionKind.BUY, "SBIN", 2, "600", T0));

        assertThatThrownBy(() -> book.record(trade(TransactionKind.SELL, "SBIN", 3, "610", T0)))
                .isInstanceOf(InsufficientQuantityException.class);

        assertThat(book.transactions()).hasSize(1);
        assertThat(book.position("SBIN").orElseThrow().getQuantity()).isEqualTo(2);
    }

    @Test
    void invalidTradesAreRejected() {
        assertThatThrownBy(() -> book.record(trade(TransactionKind.BUY, "X", 0, "10", T0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> book.record(trade(TransactionKind.BUY, " ", 1, "10", T0)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void ledgerEntriesAreJournaledWithoutMovingPositions() {
        book.record(Transaction.builder().id("c1").kind(TransactionKind.CREDIT)
                .amount(new BigDecimal("100")).timestamp(T0).reason("Bonus Coins").build());

        assertThat(book.transactions()).hasSize(1);
        assertThat(book.positions()).isEmpty();
    }

    @Test
    void reloadReplaysJournal() {
        book.record(trade(TransactionKind.BUY, "TCS", 5, "100", T0));
        book.record(trade(TransactionKind.BUY, "TCS", 5, "120", T0));
        book.record(trade(TransactionKind.SELL, "TCS", 3, "130", T0));
        book.unload();
        assertThat(book.positions()).isEmpty();

        PositionBook restarted = new PositionBook(store, mapper);
        restarted.load("u1");

        Position p = restarted.position("TCS").orElseThrow();
        assertThat(p.getQuantity()).isEqualTo(7);
        assertThat(p.getAverageCost()).isEqualByComparingTo("110");
        assertThat(restarted.transactions()).hasSize(3);
    }

    @Test
    void journalsOfPrincipalsAreSeparate() {
        book.record(trade(TransactionKind.BUY, "TCS", 1, "100", T0));

        PositionBook other = new PositionBook(store, mapper);
        other.load("u2");

        assertThat(other.positions()).isEmpty();
        assertThat(store.namespace("portfolio").keys("")).containsExactly("u1:journal");
    }
}
