package com.nifty.bulk.client.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.nifty.bulk.client.common.exception.ReconciliationException;
import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.LedgerDeltaRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class RestLedgerGateway extends RestGatewaySupport implements LedgerGateway {

    public RestLedgerGateway(RestTemplate rest, @Qualifier("gatewayExecutor") Executor io) {
        super(rest, io);
    }

    /**
     * Coin amounts come from {@code /coins/balance/{id}/details}; the wallet comes from the same
     * payload when the server includes it, otherwise from {@code /coins/balance}. A snapshot
     * without either balance is rejected so the cache keeps what it has.
     */
    @Override
    public CompletableFuture<LedgerBalance> fetchSnapshot(String principalId, String bearerToken) {
        return async(() -> {
            JsonNode d = unwrap(exchange(HttpMethod.GET, "/coins/balance/" + principalId + "/details", null, bearerToken));
            if (d == null) {
                throw new ReconciliationException("Empty ledger snapshot for " + principalId);
            }
            BigDecimal reward = required(d, "coin balance", "rewardAmount", "coinBalance", "balance");
            BigDecimal wallet = optional(d, "walletAmount", "walletBalance");
            if (wallet == null) {
                JsonNode w = unwrap(exchange(HttpMethod.GET, "/coins/balance", null, bearerToken));
                wallet = required(w, "wallet balance", "walletAmount", "walletBalance", "balance");
            }
            // lifetime totals are informational; servers that do not track them report none
            BigDecimal earned = optional(d, "totalRewardEarned", "totalCoinsEarned");
            BigDecimal purchased = optional(d, "totalRewardPurchased", "totalCoinsPurchased", "totalPurchased");
            return LedgerBalance.builder()
                    .walletAmount(wallet)
                    .rewardAmount(reward)
                    .totalRewardEarned(earned == null ? BigDecimal.ZERO : earned)
                    .totalRewardPurchased(purchased == null ? BigDecimal.ZERO : purchased)
                    .asOf(Instant.now())
                    .build();
        });
    }

    @Override
    public CompletableFuture<Void> debit(LedgerDeltaRequest request, String bearerToken) {
        return async(() -> {
            exchange(HttpMethod.POST, "/coins/deduct", request, bearerToken);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> credit(LedgerDeltaRequest request, String bearerToken) {
        return async(() -> {
            exchange(HttpMethod.POST, "/coins/add", request, bearerToken);
            return null;
        });
    }

    private static BigDecimal required(JsonNode node, String what, String... names) {
        BigDecimal v = optional(node, names);
        if (v == null) {
            throw new ReconciliationException("Ledger snapshot has no " + what);
        }
        return v;
    }

    private static BigDecimal optional(JsonNode node, String... names) {
        String raw = text(node, names);
        if (raw == null) return null;
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new ReconciliationException("Non-numeric ledger amount '" + raw + "'", e);
        }
    }
}
