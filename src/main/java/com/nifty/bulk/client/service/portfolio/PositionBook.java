package com.nifty.bulk.client.service.portfolio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.common.constants.StoreNamespaces;
import com.nifty.bulk.client.common.exception.InsufficientQuantityException;
import com.nifty.bulk.client.common.exception.NotAuthenticatedException;
import com.nifty.bulk.client.common.exception.ValidationException;
import com.nifty.bulk.client.core.NamespacedStateStore;
import com.nifty.bulk.client.core.StateStore;
import com.nifty.bulk.client.core.StateStoreException;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only transaction journal of one principal and the open positions derived from it.
 * Positions are rebuilt by replaying the journal on load.
 */
@Service
@Slf4j
public class PositionBook {

    private static final String JOURNAL = ":journal";
    private static final TypeReference<List<Transaction>> JOURNAL_TYPE = new TypeReference<>() {
    };

    private final NamespacedStateStore persisted;
    private final ObjectMapper mapper;

    private String principalId;
    private final List<Transaction> journal = new ArrayList<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();

    public PositionBook(StateStore store, ObjectMapper mapper) {
        this.persisted = store.namespace(StoreNamespaces.PORTFOLIO);
        this.mapper = mapper;
    }

    public synchronized void load(String principalId) {
        this.principalId = principalId;
        journal.clear();
        positions.clear();
        Optional<String> raw = persisted.get(principalId + JOURNAL);
        if (raw.isEmpty()) {
            log.info("No journal for {}", principalId);
            return;
        }
        List<Transaction> entries;
        try {
            entries = mapper.readValue(raw.get(), JOURNAL_TYPE);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Unreadable journal for " + principalId, e);
        }
        for (Transaction t : entries) {
            journal.add(t);
            if (t.getKind() != null && t.getKind().isTrade()) {
                try {
                    apply(t);
                } catch (InsufficientQuantityException e) {
                    log.warn("Journal entry {} does not replay: {}", t.getId(), e.getMessage());
                }
            }
        }
        log.info("Replayed {} journal entries for {} -> {} open positions", journal.size(), principalId, positions.size());
    }

    /**
     * Appends a transaction; BUY and SELL also move the position. An oversell is rejected
     * before anything is written.
     */
    public synchronized void record(Transaction t) {
        if (principalId == null) {
            throw new NotAuthenticatedException("Position book is not loaded");
        }
        validate(t);
        if (t.getKind() == TransactionKind.SELL) {
            String sym = symbol(t);
            long held = Optional.ofNullable(positions.get(sym)).map(Position::getQuantity).orElse(0L);
            if (t.getQuantity() > held) {
                throw new InsufficientQuantityException(sym, held, t.getQuantity());
            }
        }
        journal.add(t);
        try {
            persist();
        } catch (StateStoreException e) {
            journal.remove(journal.size() - 1);
            throw e;
        }
        if (t.getKind().isTrade()) {
            apply(t);
        }
    }

    private void apply(Transaction t) {
        String sym = symbol(t);
        long qty = t.getQuantity();
        Position existing = positions.get(sym);

        if (t.getKind() == TransactionKind.BUY) {
            if (existing == null) {
                positions.put(sym, Position.builder()
                        .instrumentSymbol(sym)
                        .quantity(qty)
                        .averageCost(t.getPrice())
                        .currentQuote(t.getPrice())
                        .openedAt(t.getTimestamp())
                        .build());
                return;
            }
            long total = existing.getQuantity() + qty;
            BigDecimal cost = existing.getAverageCost().multiply(BigDecimal.valueOf(existing.getQuantity()))
                    .add(t.getPrice().multiply(BigDecimal.valueOf(qty)));
            BigDecimal avg = cost.divide(BigDecimal.valueOf(total), 6, RoundingMode.HALF_UP);
            positions.put(sym, existing.toBuilder()
                    .quantity(total)
                    .averageCost(avg)
                    .currentQuote(t.getPrice())
                    .build());
            return;
        }

        long held = existing == null ? 0 : existing.getQuantity();
        if (qty > held) {
            throw new InsufficientQuantityException(sym, held, qty);
        }
        if (qty == held) {
            positions.remove(sym);
        } else {
            positions.put(sym, existing.toBuilder()
                    .quantity(held - qty)
                    .currentQuote(t.getPrice())
                    .build());
        }
    }

    private static void validate(Transaction t) {
        if (t == null || t.getKind() == null) {
            throw new ValidationException("Transaction kind is required");
        }
        if (t.getKind().isTrade()) {
            if (t.getInstrumentSymbol() == null || t.getInstrumentSymbol().isBlank()) {
                throw new ValidationException("Trade needs an instrument symbol");
            }
            if (t.getQuantity() == null || t.getQuantity() <= 0) {
                throw new ValidationException("Trade quantity must be positive");
            }
            if (t.getPrice() == null || t.getPrice().signum() <= 0) {
                throw new ValidationException("Trade price must be positive");
            }
        }
    }

    private static String symbol(Transaction t) {
        return t.getInstrumentSymbol().trim().toUpperCase(Locale.ROOT);
    }

    private void persist() {
        try {
            persisted.put(principalId + JOURNAL, mapper.writeValueAsString(journal));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Cannot serialize journal", e);
        }
    }

    public synchronized List<Position> positions() {
        return Collections.unmodifiableList(new ArrayList<>(positions.values()));
    }

    public synchronized Optional<Position> position(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(positions.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Journal in append order.
     */
    public synchronized List<Transaction> transactions() {
        return Collections.unmodifiableList(new ArrayList<>(journal));
    }

    public synchronized boolean isLoaded() {
        return principalId != null;
    }

    /**
     * Forgets the in-memory book; the persisted journal stays for the next login.
     */
    public synchronized void unload() {
        principalId = null;
        journal.clear();
        positions.clear();
    }
}
