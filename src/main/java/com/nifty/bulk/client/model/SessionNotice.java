package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.SessionEndReason;

import java.time.Instant;

/**
 * Pushed on "session.notice" when a session ends; {@code takeover} is set when another
 * login displaced this one.
 */
public record SessionNotice(String principalId, SessionEndReason reason, boolean takeover, String message, Instant at) {
}
