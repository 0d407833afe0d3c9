package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.SessionRole;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * The authenticated session of this client. Identity fields are fixed for the lifetime of
 * the instance; the bearer token and its expiry rotate in place on refresh.
 */
@Getter
@ToString(exclude = "bearerToken")
public final class Session {

    private final String instanceId;     // unique per authenticate/resume
    private final String principalId;
    private final String displayName;
    private final SessionRole role;
    private final String fencingToken;

    private volatile String bearerToken;
    private volatile Instant tokenExpiryInstant; // null when the token carries no exp claim

    @Builder
    private Session(String instanceId, String principalId, String displayName, SessionRole role,
                    String fencingToken, String bearerToken, Instant tokenExpiryInstant) {
        this.instanceId = instanceId;
        this.principalId = principalId;
        this.displayName = displayName;
        this.role = role == null ? SessionRole.STANDARD : role;
        this.fencingToken = fencingToken;
        this.bearerToken = bearerToken;
        this.tokenExpiryInstant = tokenExpiryInstant;
    }

    /** Refresh result: new token and expiry, same session instance. */
    public synchronized void rotate(String newBearerToken, Instant newExpiry) {
        this.bearerToken = newBearerToken;
        this.tokenExpiryInstant = newExpiry;
    }
}
