package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.SessionRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Claims read from a bearer token payload. Untrusted: used for display, refresh scheduling
 * and seeding the ledger cache, never for authorization.
 */
@Value
@Builder
public class TokenClaims {
    String principalId;
    String displayName;
    SessionRole role;
    Instant expiresAt;         // null if the token has no exp claim
    LedgerBalance seedBalance; // null if the token carries no balance claims
}
