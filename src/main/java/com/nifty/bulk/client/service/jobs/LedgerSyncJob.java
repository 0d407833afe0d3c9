package com.nifty.bulk.client.service.jobs;

import com.nifty.bulk.client.enums.SessionRole;
import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.Session;
import com.nifty.bulk.client.service.gateway.LedgerGateway;
import com.nifty.bulk.client.service.ledger.LedgerCache;
import com.nifty.bulk.client.service.session.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authoritative ledger pull. At most one pull is in flight; a failed pull leaves the cache
 * as it was and the next tick tries again.
 */
@Component
@Slf4j
public class LedgerSyncJob implements Runnable {

    public static final String NAME = "ledger-reconcile";

    private final SessionManager sessions;
    private final LedgerCache ledger;
    private final LedgerGateway gateway;
    private final Executor sync;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public LedgerSyncJob(SessionManager sessions, LedgerCache ledger, LedgerGateway gateway,
                         @Qualifier("syncScheduler") Executor sync) {
        this.sessions = sessions;
        this.ledger = ledger;
        this.gateway = gateway;
        this.sync = sync;
    }

    @Override
    public void run() {
        pull();
    }

    /**
     * @return the pull's outcome; an already-completed future when the tick was skipped
     */
    public CompletableFuture<Optional<LedgerBalance>> pull() {
        Optional<Session> maybe = sessions.currentSession();
        if (maybe.isEmpty() || !sessions.state().isLive()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        Session s = maybe.get();
        if (s.getRole() == SessionRole.SUPER_OPERATOR) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Ledger pull already in flight; skipping tick");
            return CompletableFuture.completedFuture(Optional.empty());
        }

        CompletableFuture<Optional<LedgerBalance>> out = new CompletableFuture<>();
        CompletableFuture<LedgerBalance> call;
        try {
            call = gateway.fetchSnapshot(s.getPrincipalId(), s.getBearerToken());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenCompleteAsync((snapshot, err) -> {
            inFlight.set(false);
            if (!sessions.isCurrent(s.getInstanceId())) {
                log.debug("Dropping ledger snapshot for ended session {}", s.getInstanceId());
                out.complete(Optional.empty());
                return;
            }
            if (err != null) {
                log.warn("Ledger pull failed, keeping cached balance: {}", err.getMessage());
                out.complete(Optional.empty());
                return;
            }
            try {
                out.complete(Optional.of(ledger.reconcile(snapshot)));
            } catch (RuntimeException e) {
                log.warn("Ledger snapshot rejected: {}", e.getMessage());
                out.complete(Optional.empty());
            }
        }, sync);
        return out;
    }

    public boolean isInFlight() {
        return inFlight.get();
    }
}
