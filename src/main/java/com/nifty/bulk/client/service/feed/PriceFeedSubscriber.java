package com.nifty.bulk.client.service.feed;

import com.nifty.bulk.client.model.PriceQuote;
import com.nifty.bulk.client.service.gateway.PriceFeedConnection;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Multiplexes one feed connection across any number of subscribers.
 * <p>
 * Symbols are reference counted: the connection subscribes a symbol on its first subscriber
 * and releases it with the last. Quotes are replaced wholesale; a tick older than the quote
 * already held for its symbol is dropped.
 */
@Service
@Slf4j
public class PriceFeedSubscriber {

    private final PriceFeedConnection connection;

    private final Map<String, PriceQuote> latest = new ConcurrentHashMap<>();
    private final Map<String, Integer> refCounts = new HashMap<>();
    private final CopyOnWriteArrayList<Handle> handles = new CopyOnWriteArrayList<>();

    public PriceFeedSubscriber(PriceFeedConnection connection) {
        this.connection = connection;
    }

    @PostConstruct
    public void open() {
        connection.open(this::onTick);
    }

    /**
     * Handle returned by {@link #subscribe}; {@link #unsubscribe()} may be called more than once.
     */
    public interface Subscription {
        Set<String> symbols();

        void unsubscribe();

        boolean isActive();
    }

    public Subscription subscribe(Collection<String> symbols, Consumer<PriceQuote> onTick) {
        if (symbols == null || onTick == null) {
            throw new IllegalArgumentException("symbols and onTick are required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String s : symbols) {
            if (s != null && !s.isBlank()) normalized.add(s.trim().toUpperCase(Locale.ROOT));
        }
        Handle h = new Handle(Collections.unmodifiableSet(normalized), onTick);
        synchronized (refCounts) {
            for (String sym : normalized) {
                int n = refCounts.merge(sym, 1, Integer::sum);
                if (n == 1) {
                    connection.subscribe(sym);
                }
            }
            handles.add(h);
        }
        log.debug("Subscribed {}", normalized);
        return h;
    }

    private void release(Handle h) {
        synchronized (refCounts) {
            handles.remove(h);
            for (String sym : h.symbols) {
                Integer n = refCounts.get(sym);
                if (n == null) continue;
                if (n <= 1) {
                    refCounts.remove(sym);
                    connection.unsubscribe(sym);
                    latest.remove(sym);
                } else {
                    refCounts.put(sym, n - 1);
                }
            }
        }
        log.debug("Unsubscribed {}", h.symbols);
    }

    /**
     * Entry point for the connection.
     */
    void onTick(PriceQuote q) {
        if (q == null || q.getInstrumentSymbol() == null || q.getPrice() == null) {
            return;
        }
        String sym = q.getInstrumentSymbol().toUpperCase(Locale.ROOT);
        AtomicBoolean accepted = new AtomicBoolean(false);
        // same lock as release() so a late tick cannot re-add a released symbol
        synchronized (refCounts) {
            if (!refCounts.containsKey(sym)) {
                return;
            }
            latest.compute(sym, (k, held) -> {
                if (isOlder(q, held)) {
                    return held;
                }
                accepted.set(true);
                return q;
            });
        }
        if (!accepted.get()) {
            log.debug("Dropping out-of-order tick for {} ({})", sym, q.getAsOf());
            return;
        }
        for (Handle h : handles) {
            if (!h.symbols.contains(sym) || !h.isActive()) continue;
            try {
                h.onTick.accept(q);
            } catch (RuntimeException e) {
                log.warn("Quote consumer failed for {}: {}", sym, e.getMessage());
            }
        }
    }

    private static boolean isOlder(PriceQuote q, PriceQuote held) {
        return held != null && held.getAsOf() != null && q.getAsOf() != null && q.getAsOf().isBefore(held.getAsOf());
    }

    public Optional<PriceQuote> quote(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(latest.get(symbol.toUpperCase(Locale.ROOT)));
    }

    public Map<String, PriceQuote> latestQuotes() {
        return Collections.unmodifiableMap(new HashMap<>(latest));
    }

    public Set<String> subscribedSymbols() {
        synchronized (refCounts) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(refCounts.keySet()));
        }
    }

    private final class Handle implements Subscription {
        private final Set<String> symbols;
        private final Consumer<PriceQuote> onTick;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Handle(Set<String> symbols, Consumer<PriceQuote> onTick) {
            this.symbols = symbols;
            this.onTick = onTick;
        }

        @Override
        public Set<String> symbols() {
            return symbols;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                release(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
