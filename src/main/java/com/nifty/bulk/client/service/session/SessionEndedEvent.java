package com.nifty.bulk.client.service.session;

import com.nifty.bulk.client.enums.SessionEndReason;
import com.nifty.bulk.client.model.Session;

import java.time.Instant;

/**
 * Published once per session instance when it is torn down.
 */
public record SessionEndedEvent(Session session, SessionEndReason reason, Instant at) {
}
