package com.nifty.bulk.client.service.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.enums.SessionRole;
import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.TokenClaims;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads the payload segment of a JWT-shaped bearer token. The signature is not verified:
 * claims are display and scheduling hints only.
 */
@Component
public class BearerTokenDecoder {

    private final ObjectMapper mapper;

    public BearerTokenDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException when the token is not a three-part token with a JSON payload
     */
    public TokenClaims decode(String token) {
        JsonNode p = payload(token);
        String principal = text(p, "id", "sub", "userId");
        if (principal == null) {
            throw new IllegalArgumentException("Token carries no principal id");
        }
        String name = text(p, "username", "name", "email");
        return TokenClaims.builder()
                .principalId(principal)
                .displayName(name == null ? principal : name)
                .role(SessionRole.fromClaim(text(p, "role")))
                .expiresAt(expiryOf(p))
                .seedBalance(balanceOf(p))
                .build();
    }

    /**
     * Expiry only; empty for tokens without exp or that cannot be parsed.
     */
    public Optional<Instant> expiry(String token) {
        try {
            return Optional.ofNullable(expiryOf(payload(token)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private JsonNode payload(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Token is null");
        }
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Token is not a three-part JWT");
        }
        String seg = parts[1].replace('+', '-').replace('/', '_');
        try {
            byte[] json = Base64.getUrlDecoder().decode(seg);
            JsonNode node = mapper.readTree(new String(json, StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Token payload is not a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new IllegalArgumentException("Token payload is not valid JSON", e);
        }
    }

    private static Instant expiryOf(JsonNode p) {
        JsonNode exp = p.get("exp");
        if (exp == null || !exp.canConvertToLong()) return null;
        return Instant.ofEpochSecond(exp.asLong());
    }

    private static LedgerBalance balanceOf(JsonNode p) {
        if (!p.has("walletBalance") && !p.has("coinBalance")) return null;
        return LedgerBalance.builder()
                .walletAmount(decimal(p, "walletBalance"))
                .rewardAmount(decimal(p, "coinBalance"))
                .totalRewardEarned(decimal(p, "totalCoinsEarned"))
                .totalRewardPurchased(decimal(p, "totalCoinsPurchased"))
                .asOf(Instant.now())
                .build();
    }

    private static BigDecimal decimal(JsonNode p, String name) {
        JsonNode v = p.get(name);
        if (v == null || v.isNull()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(v.asText());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private static String text(JsonNode p, String... names) {
        for (String n : names) {
            JsonNode v = p.get(n);
            if (v != null && !v.isNull() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }
}
