package com.nifty.bulk.client.service.session;

import com.nifty.bulk.client.common.constants.StoreNamespaces;
import com.nifty.bulk.client.common.constants.SyncProperties;
import com.nifty.bulk.client.common.exception.AuthFailureException;
import com.nifty.bulk.client.common.exception.ConcurrentSessionException;
import com.nifty.bulk.client.common.exception.NotAuthenticatedException;
import com.nifty.bulk.client.common.exception.TokenRefreshException;
import com.nifty.bulk.client.core.NamespacedStateStore;
import com.nifty.bulk.client.core.StateStore;
import com.nifty.bulk.client.enums.LoginChannel;
import com.nifty.bulk.client.enums.SessionEndReason;
import com.nifty.bulk.client.enums.SessionRole;
import com.nifty.bulk.client.enums.SessionState;
import com.nifty.bulk.client.model.AuthCredentials;
import com.nifty.bulk.client.model.Session;
import com.nifty.bulk.client.model.TokenClaims;
import com.nifty.bulk.client.service.gateway.AuthGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single active session of this client.
 * <p>
 * The persisted fencing token marks which client instance holds the active-session slot. A
 * newer login anywhere overwrites it; the older holder notices the mismatch on its next
 * watchdog tick (or right before applying a refreshed token) and invalidates itself.
 * <p>
 * Collaborator responses are applied on the sync executor. A response that arrives after its
 * session instance was torn down is dropped.
 */
@Service
@Slf4j
public class SessionManager {

    static final String KEY_TOKEN = "token";
    static final String KEY_EXPIRY = "expiry";
    static final String KEY_FENCING = "fencing";
    static final String KEY_PRINCIPAL = "principal";
    static final String KEY_ROLE = "role";
    static final String KEY_NAME = "name";

    private final NamespacedStateStore persisted;
    private final AuthGateway auth;
    private final BearerTokenDecoder decoder;
    private final SyncProperties props;
    private final Clock clock;
    private final Executor sync;
    private final ApplicationEventPublisher events;

    private final AtomicReference<Session> current = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Session>> inFlightRefresh = new AtomicReference<>();
    private volatile SessionState state = SessionState.UNAUTHENTICATED;
    private volatile SessionEndReason lastEndReason;

    public SessionManager(StateStore store,
                          AuthGateway auth,
                          BearerTokenDecoder decoder,
                          SyncProperties props,
                          Clock clock,
                          @Qualifier("syncScheduler") Executor sync,
                          ApplicationEventPublisher events) {
        this.persisted = store.namespace(StoreNamespaces.SESSION);
        this.auth = auth;
        this.decoder = decoder;
        this.props = props;
        this.clock = clock;
        this.sync = sync;
        this.events = events;
    }

    // =====================================================================
    // Authentication
    // =====================================================================

    /**
     * Exchanges credentials for a bearer token and installs a new session holding a fresh
     * fencing token. On failure any existing session is left as it was.
     */
    public CompletableFuture<Session> authenticate(AuthCredentials credentials) {
        if (credentials == null || credentials.getIdentifier() == null || credentials.getSecret() == null) {
            return CompletableFuture.failedFuture(new AuthFailureException("Credentials are incomplete"));
        }
        final SessionState before = state;
        if (current.get() == null) {
            state = SessionState.AUTHENTICATING;
        }
        log.info("Authenticating {} via {}", credentials.getIdentifier(), credentials.getChannel());

        CompletableFuture<Session> out = new CompletableFuture<>();
        auth.authenticate(credentials).whenCompleteAsync((token, err) -> {
            if (err != null) {
                restoreAfterFailedLogin(before);
                out.completeExceptionally(unwrap(err));
                return;
            }
            try {
                out.complete(install(token, credentials.getChannel()));
            } catch (RuntimeException e) {
                restoreAfterFailedLogin(before);
                out.completeExceptionally(e);
            }
        }, sync);
        return out;
    }

    private void restoreAfterFailedLogin(SessionState before) {
        if (current.get() == null) {
            state = before == SessionState.AUTHENTICATING ? SessionState.UNAUTHENTICATED : before;
        }
        log.warn("Authentication failed; existing session {}", current.get() == null ? "none" : "kept");
    }

    private Session install(String token, LoginChannel channel) {
        TokenClaims claims;
        try {
            claims = decoder.decode(token);
        } catch (IllegalArgumentException e) {
            throw new AuthFailureException("Server returned an unreadable token: " + e.getMessage(), e);
        }
        SessionRole role = channel == LoginChannel.SUPER_OPERATOR ? SessionRole.SUPER_OPERATOR : claims.getRole();

        Session previous = current.get();
        if (previous != null) {
            endSession(previous, SessionEndReason.LOGOUT);
        }

        Session s = Session.builder()
                .instanceId(UUID.randomUUID().toString())
                .principalId(claims.getPrincipalId())
                .displayName(claims.getDisplayName())
                .role(role)
                .fencingToken(UUID.randomUUID().toString())
                .bearerToken(token)
                .tokenExpiryInstant(claims.getExpiresAt())
                .build();

        persisted.put(KEY_TOKEN, token);
        persisted.put(KEY_EXPIRY, claims.getExpiresAt() == null ? null : claims.getExpiresAt().toString());
        persisted.put(KEY_PRINCIPAL, s.getPrincipalId());
        persisted.put(KEY_ROLE, role.name());
        persisted.put(KEY_NAME, s.getDisplayName());
        // written last: claiming the slot
        persisted.put(KEY_FENCING, s.getFencingToken());

        current.set(s);
        state = SessionState.ACTIVE;
        lastEndReason = null;
        log.info("Session {} active for {} ({})", s.getInstanceId(), s.getPrincipalId(), role);
        return s;
    }

    /**
     * Re-creates the session from persisted fields without an authentication round-trip.
     * An expired persisted token is cleared.
     */
    public Optional<Session> resume(Instant now) {
        Session live = current.get();
        if (live != null) {
            return Optional.of(live);
        }
        Optional<String> token = persisted.get(KEY_TOKEN);
        Optional<String> fencing = persisted.get(KEY_FENCING);
        if (token.isEmpty() || fencing.isEmpty()) {
            log.debug("Nothing to resume");
            return Optional.empty();
        }

        Instant expiry = persisted.get(KEY_EXPIRY).map(SessionManager::parseInstant)
                .orElseGet(() -> decoder.expiry(token.get()).orElse(null));
        if (expiry != null && !expiry.isAfter(now)) {
            log.info("Persisted session expired at {}; clearing", expiry);
            clearPersisted();
            return Optional.empty();
        }

        String principal = persisted.get(KEY_PRINCIPAL).orElse(null);
        String name = persisted.get(KEY_NAME).orElse(null);
        SessionRole role = persisted.get(KEY_ROLE).map(SessionRole::fromClaim).orElse(null);
        if (principal == null || role == null) {
            try {
                TokenClaims claims = decoder.decode(token.get());
                principal = principal == null ? claims.getPrincipalId() : principal;
                name = name == null ? claims.getDisplayName() : name;
                role = role == null ? claims.getRole() : role;
            } catch (IllegalArgumentException e) {
                log.warn("Persisted token is unreadable; clearing: {}", e.getMessage());
                clearPersisted();
                return Optional.empty();
            }
        }

        Session s = Session.builder()
                .instanceId(UUID.randomUUID().toString())
                .principalId(principal)
                .displayName(name == null ? principal : name)
                .role(role)
                .fencingToken(fencing.get())
                .bearerToken(token.get())
                .tokenExpiryInstant(expiry)
                .build();
        if (!current.compareAndSet(null, s)) {
            return Optional.ofNullable(current.get());
        }
        state = SessionState.ACTIVE;
        lastEndReason = null;
        log.info("Session {} resumed for {}", s.getInstanceId(), principal);
        return Optional.of(s);
    }

    // =====================================================================
    // Refresh
    // =====================================================================

    /**
     * Exchanges the bearer token when it expires within the refresh threshold. Overlapping
     * calls share the single in-flight exchange. A failed exchange ends the session (EXPIRED).
     *
     * @return the session after this tick; completes exceptionally when the session ended
     */
    public CompletableFuture<Session> refreshIfNeeded(Instant now) {
        CompletableFuture<Session> pending = inFlightRefresh.get();
        if (pending != null) {
            log.debug("Refresh already in flight");
            return pending;
        }
        Session s = current.get();
        if (s == null || state != SessionState.ACTIVE) {
            return CompletableFuture.completedFuture(s);
        }
        Instant expiry = s.getTokenExpiryInstant();
        if (expiry == null || Duration.between(now, expiry).compareTo(props.getRefreshThreshold()) >= 0) {
            return CompletableFuture.completedFuture(s);
        }

        if (!ownsSlot(s)) {
            endSession(s, SessionEndReason.CONCURRENT_SESSION);
            return CompletableFuture.failedFuture(
                    new ConcurrentSessionException(SessionEndReason.CONCURRENT_SESSION.getNotice()));
        }

        CompletableFuture<Session> result = new CompletableFuture<>();
        if (!inFlightRefresh.compareAndSet(null, result)) {
            CompletableFuture<Session> other = inFlightRefresh.get();
            return other != null ? other : CompletableFuture.completedFuture(current.get());
        }
        state = SessionState.REFRESHING;
        log.info("Refreshing token for {} (expires {})", s.getPrincipalId(), expiry);

        try {
            auth.exchange(s.getBearerToken())
                    .whenCompleteAsync((token, err) -> applyRefresh(s, token, err, result), sync);
        } catch (RuntimeException e) {
            applyRefresh(s, null, e, result);
        }
        return result;
    }

    private void applyRefresh(Session s, String token, Throwable err, CompletableFuture<Session> result) {
        inFlightRefresh.compareAndSet(result, null);

        if (current.get() != s) {
            log.debug("Dropping refresh response for ended session {}", s.getInstanceId());
            result.completeExceptionally(new NotAuthenticatedException("Session ended during token refresh"));
            return;
        }
        if (err != null || token == null) {
            Throwable cause = err == null ? null : unwrap(err);
            log.warn("Token refresh failed for {}: {}", s.getPrincipalId(),
                    cause == null ? "empty token" : cause.getMessage());
            endSession(s, SessionEndReason.REFRESH_FAILED);
            result.completeExceptionally(new TokenRefreshException("Token refresh failed", cause));
            return;
        }
        if (!ownsSlot(s)) {
            endSession(s, SessionEndReason.CONCURRENT_SESSION);
            result.completeExceptionally(new ConcurrentSessionException(SessionEndReason.CONCURRENT_SESSION.getNotice()));
            return;
        }

        Instant expiry = decoder.expiry(token).orElse(null);
        s.rotate(token, expiry);
        persisted.put(KEY_TOKEN, token);
        persisted.put(KEY_EXPIRY, expiry == null ? null : expiry.toString());
        state = SessionState.ACTIVE;
        log.info("Token refreshed for {} (now expires {})", s.getPrincipalId(), expiry);
        result.complete(s);
    }

    // =====================================================================
    // Fencing / teardown
    // =====================================================================

    /**
     * @return true when another login took the slot and this session was invalidated
     */
    public boolean detectConcurrentSession() {
        Session s = current.get();
        if (s == null || !state.isLive()) {
            return false;
        }
        if (ownsSlot(s)) {
            return false;
        }
        log.warn("Fencing token changed under session {}; another login took over", s.getInstanceId());
        return endSession(s, SessionEndReason.CONCURRENT_SESSION);
    }

    public void logout() {
        teardown(SessionEndReason.LOGOUT);
    }

    /**
     * Revokes every session of the principal remotely, then ends this one whatever the outcome.
     */
    public CompletableFuture<Void> logoutAllDevices() {
        Session s = current.get();
        if (s == null) {
            return CompletableFuture.failedFuture(new NotAuthenticatedException());
        }
        return auth.revokeAll(s.getBearerToken()).handleAsync((v, err) -> {
            if (err != null) {
                log.warn("Remote logout-all failed, ending local session anyway: {}", unwrap(err).getMessage());
            }
            endSession(s, SessionEndReason.LOGOUT_ALL_DEVICES);
            return null;
        }, sync);
    }

    public void teardown(SessionEndReason reason) {
        Session s = current.get();
        if (s != null) {
            endSession(s, reason);
        }
    }

    private boolean endSession(Session s, SessionEndReason reason) {
        if (!current.compareAndSet(s, null)) {
            return false;
        }
        state = reason.getTerminalState();
        lastEndReason = reason;
        if (reason.clearsPersistedState()) {
            Optional<String> fencing = persisted.get(KEY_FENCING);
            if (fencing.isEmpty() || fencing.get().equals(s.getFencingToken())) {
                clearPersisted();
            } else {
                log.info("Persisted session belongs to another login; leaving it");
            }
        }
        log.info("Session {} ended: {} -> {}", s.getInstanceId(), reason, state);
        events.publishEvent(new SessionEndedEvent(s, reason, clock.instant()));
        return true;
    }

    private boolean ownsSlot(Session s) {
        return persisted.get(KEY_FENCING).map(s.getFencingToken()::equals).orElse(false);
    }

    private void clearPersisted() {
        persisted.deleteAll("");
    }

    // =====================================================================
    // Reads
    // =====================================================================

    public Optional<Session> currentSession() {
        return Optional.ofNullable(current.get());
    }

    public Session requireSession() {
        Session s = current.get();
        if (s == null) {
            throw new NotAuthenticatedException();
        }
        return s;
    }

    public boolean isCurrent(String instanceId) {
        Session s = current.get();
        return s != null && s.getInstanceId().equals(instanceId);
    }

    public SessionState state() {
        return state;
    }

    public Optional<SessionEndReason> lastEndReason() {
        return Optional.ofNullable(lastEndReason);
    }

    public boolean isRefreshInFlight() {
        return inFlightRefresh.get() != null;
    }

    private static Instant parseInstant(String raw) {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable persisted expiry '{}'", raw);
            return null;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while (cur instanceof CompletionException && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
