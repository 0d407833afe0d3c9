package com.nifty.bulk.client.service.gateway;

import com.nifty.bulk.client.model.TradeOrder;

import java.util.concurrent.CompletableFuture;

public interface TradeGateway {

    /**
     * Submits a buy or sell; completes with the server-side trade id once accepted.
     */
    CompletableFuture<String> submit(TradeOrder order, String bearerToken);
}
