package com.nifty.bulk.client.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.TradeOrder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class RestTradeGateway extends RestGatewaySupport implements TradeGateway {

    public RestTradeGateway(RestTemplate rest, @Qualifier("gatewayExecutor") Executor io) {
        super(rest, io);
    }

    @Override
    public CompletableFuture<String> submit(TradeOrder order, String bearerToken) {
        return async(() -> {
            String path = order.getType() == TransactionKind.SELL ? "/trades/sell" : "/trades/buy";
            JsonNode root = exchange(HttpMethod.POST, path, order, bearerToken);
            String id = text(unwrap(root), "id", "tradeId");
            // older servers accept the trade without echoing an id
            return id != null ? id : UUID.randomUUID().toString();
        });
    }
}
