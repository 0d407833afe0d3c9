package com.nifty.bulk.client.service.jobs;

import com.nifty.bulk.client.service.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Session watchdog tick: fencing check first, then a token refresh when expiry is near.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionWatchdogJob implements Runnable {

    public static final String NAME = "session-watchdog";

    private final SessionManager sessions;
    private final Clock clock;

    @Override
    public void run() {
        if (sessions.currentSession().isEmpty()) {
            return;
        }
        if (sessions.detectConcurrentSession()) {
            return;
        }
        sessions.refreshIfNeeded(clock.instant()).whenComplete((s, err) -> {
            if (err != null) {
                log.warn("Watchdog refresh ended the session: {}", err.getMessage());
            }
        });
    }
}
