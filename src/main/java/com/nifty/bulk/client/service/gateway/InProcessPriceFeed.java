package com.nifty.bulk.client.service.gateway;

import com.nifty.bulk.client.model.PriceQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Feed connection fed from inside the process (the local quote push endpoint or an adapter
 * bridging an external stream). Ticks for symbols nobody subscribed to are dropped here.
 */
@Component
@Slf4j
public class InProcessPriceFeed implements PriceFeedConnection {

    private final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    private volatile Consumer<PriceQuote> sink;

    @Override
    public void open(Consumer<PriceQuote> sink) {
        this.sink = sink;
    }

    @Override
    public void subscribe(String symbol) {
        subscribed.add(symbol);
        log.debug("feed: +{}", symbol);
    }

    @Override
    public void unsubscribe(String symbol) {
        subscribed.remove(symbol);
        log.debug("feed: -{}", symbol);
    }

    public boolean isSubscribed(String symbol) {
        return symbol != null && subscribed.contains(symbol.toUpperCase(Locale.ROOT));
    }

    /**
     * @return true when the quote was delivered to the sink
     */
    public boolean publish(PriceQuote quote) {
        Consumer<PriceQuote> s = sink;
        if (s == null || quote == null || quote.getInstrumentSymbol() == null
                || !subscribed.contains(quote.getInstrumentSymbol().toUpperCase(Locale.ROOT))) {
            return false;
        }
        s.accept(quote);
        return true;
    }
}
