package com.nifty.bulk.client.service.portfolio;

import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.PriceQuote;
import com.nifty.bulk.client.service.feed.PriceFeedSubscriber;
import com.nifty.bulk.client.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keeps a valuation of the position book current: subscribes the feed to every held symbol,
 * and revalues on each tick and after each position change. Quotes seen for a symbol are kept
 * so a feed gap falls back to the last known price.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LivePortfolioService {

    public static final String TOPIC = "portfolio.valuation";

    private final PositionBook book;
    private final PriceFeedSubscriber feed;
    private final PortfolioValuationEngine engine;
    private final StreamGateway stream;

    private final Map<String, PriceQuote> lastKnown = new HashMap<>();
    private PriceFeedSubscriber.Subscription subscription;
    private PortfolioValuation latest = PortfolioValuation.EMPTY;

    public synchronized void start() {
        resubscribe();
        recompute();
    }

    /**
     * Called after the book changed (trade recorded or journal replayed).
     */
    public synchronized PortfolioValuation positionsChanged() {
        resubscribe();
        return recompute();
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        lastKnown.clear();
        latest = PortfolioValuation.EMPTY;
        log.info("Live valuation stopped");
    }

    public synchronized PortfolioValuation current() {
        return latest;
    }

    private void onTick(PriceQuote q) {
        synchronized (this) {
            lastKnown.put(q.getInstrumentSymbol().toUpperCase(Locale.ROOT), q);
            recompute();
        }
    }

    private PortfolioValuation recompute() {
        Map<String, PriceQuote> quotes = new HashMap<>(lastKnown);
        feed.latestQuotes().forEach(quotes::putIfAbsent);
        latest = engine.revalue(book.positions(), quotes);
        stream.send(TOPIC, latest);
        return latest;
    }

    private void resubscribe() {
        Set<String> wanted = new LinkedHashSet<>();
        for (Position p : book.positions()) {
            wanted.add(p.getInstrumentSymbol());
        }
        if (subscription != null && subscription.isActive() && subscription.symbols().equals(wanted)) {
            return;
        }
        PriceFeedSubscriber.Subscription previous = subscription;
        // subscribe first so symbols held by both never drop off the connection
        subscription = wanted.isEmpty() ? null : feed.subscribe(wanted, this::onTick);
        if (previous != null) {
            previous.unsubscribe();
        }
        lastKnown.keySet().retainAll(wanted);
        log.debug("Valuation feed symbols: {}", wanted);
    }
}
