package com.nifty.bulk.client.service.gateway;

import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.LedgerDeltaRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Remote ledger service: the durable source of truth for balances.
 */
public interface LedgerGateway {

    CompletableFuture<LedgerBalance> fetchSnapshot(String principalId, String bearerToken);

    CompletableFuture<Void> debit(LedgerDeltaRequest request, String bearerToken);

    CompletableFuture<Void> credit(LedgerDeltaRequest request, String bearerToken);
}
