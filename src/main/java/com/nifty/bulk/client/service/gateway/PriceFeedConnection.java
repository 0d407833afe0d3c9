package com.nifty.bulk.client.service.gateway;

import com.nifty.bulk.client.model.PriceQuote;

import java.util.function.Consumer;

/**
 * Push-style market data source keyed by instrument symbol. One connection is shared by
 * every consumer in the client; the wire protocol behind it is the implementation's concern.
 */
public interface PriceFeedConnection {

    /**
     * Registers the single sink that receives every tick for subscribed symbols.
     */
    void open(Consumer<PriceQuote> sink);

    void subscribe(String symbol);

    void unsubscribe(String symbol);
}
