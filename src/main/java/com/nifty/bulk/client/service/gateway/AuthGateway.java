package com.nifty.bulk.client.service.gateway;

import com.nifty.bulk.client.model.AuthCredentials;

import java.util.concurrent.CompletableFuture;

/**
 * Remote authentication endpoint. All calls are asynchronous round-trips.
 */
public interface AuthGateway {

    /**
     * Exchanges credentials for a bearer token with an embedded expiry claim.
     * Completes exceptionally with AuthFailureException when the credentials are rejected.
     */
    CompletableFuture<String> authenticate(AuthCredentials credentials);

    /**
     * Re-issues a token given a still-valid one.
     */
    CompletableFuture<String> exchange(String bearerToken);

    /**
     * Revokes every session of the token's principal on the server.
     */
    CompletableFuture<Void> revokeAll(String bearerToken);
}
