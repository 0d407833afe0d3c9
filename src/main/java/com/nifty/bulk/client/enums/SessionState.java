package com.nifty.bulk.client.enums;

/**
 * Lifecycle of one session instance.
 * UNAUTHENTICATED -> AUTHENTICATING -> ACTIVE -> (REFRESHING -> ACTIVE | EXPIRED),
 * ACTIVE -> INVALIDATED on fencing mismatch or logout.
 */
public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATING,
    ACTIVE,
    REFRESHING,
    EXPIRED,
    INVALIDATED;

    /** Authenticated calls are allowed (a refresh in flight still carries a valid token). */
    public boolean isLive() {
        return this == ACTIVE || this == REFRESHING;
    }
}
