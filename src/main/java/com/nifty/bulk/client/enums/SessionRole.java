package com.nifty.bulk.client.enums;

import java.util.Locale;

public enum SessionRole {

    STANDARD("user"),
    OPERATOR("admin"),
    SUPER_OPERATOR("superadmin");

    private final String claim;

    SessionRole(String claim) {
        this.claim = claim;
    }

    /**
     * Value of the {@code role} claim as the auth service writes it.
     */
    public String getClaim() {
        return claim;
    }

    /**
     * Lenient parse of a token claim or persisted value; unknown or missing means STANDARD.
     */
    public static SessionRole fromClaim(String raw) {
        if (raw == null || raw.isBlank()) return STANDARD;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (SessionRole r : values()) {
            if (r.claim.equals(v) || r.name().equalsIgnoreCase(v)) return r;
        }
        return STANDARD;
    }

    public boolean isOperator() {
        return this == OPERATOR || this == SUPER_OPERATOR;
    }
}
