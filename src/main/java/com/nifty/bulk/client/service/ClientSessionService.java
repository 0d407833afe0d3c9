package com.nifty.bulk.client.service;

import com.nifty.bulk.client.common.Result;
import com.nifty.bulk.client.common.constants.ApiProperties;
import com.nifty.bulk.client.common.constants.LedgerConstants;
import com.nifty.bulk.client.common.constants.SyncProperties;
import com.nifty.bulk.client.common.exception.BaseClientException;
import com.nifty.bulk.client.common.exception.GatewayException;
import com.nifty.bulk.client.common.exception.InsufficientBalanceException;
import com.nifty.bulk.client.common.exception.InsufficientQuantityException;
import com.nifty.bulk.client.common.exception.NotAuthenticatedException;
import com.nifty.bulk.client.common.exception.ValidationException;
import com.nifty.bulk.client.enums.DeltaKind;
import com.nifty.bulk.client.enums.LedgerAccount;
import com.nifty.bulk.client.enums.SessionEndReason;
import com.nifty.bulk.client.enums.SessionRole;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.AuthCredentials;
import com.nifty.bulk.client.model.BalanceCheck;
import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.LedgerDeltaRequest;
import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.Position;
import com.nifty.bulk.client.model.Session;
import com.nifty.bulk.client.model.SessionNotice;
import com.nifty.bulk.client.model.SessionView;
import com.nifty.bulk.client.model.TokenClaims;
import com.nifty.bulk.client.model.TradeOrder;
import com.nifty.bulk.client.model.Transaction;
import com.nifty.bulk.client.service.gateway.LedgerGateway;
import com.nifty.bulk.client.service.gateway.TradeGateway;
import com.nifty.bulk.client.service.jobs.LedgerSyncJob;
import com.nifty.bulk.client.service.jobs.SessionWatchdogJob;
import com.nifty.bulk.client.service.ledger.LedgerCache;
import com.nifty.bulk.client.service.portfolio.LivePortfolioService;
import com.nifty.bulk.client.service.portfolio.PositionBook;
import com.nifty.bulk.client.service.session.BearerTokenDecoder;
import com.nifty.bulk.client.service.session.SessionEndedEvent;
import com.nifty.bulk.client.service.session.SessionManager;
import com.nifty.bulk.client.service.streaming.StreamGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the view layer. Wires the session lifecycle to the ledger, the position
 * book and the timers, and turns every outcome into a {@link Result}.
 * <p>
 * Ledger deltas are applied locally first and forwarded to the server afterwards; a failed
 * forward is left for the next reconciliation pull to correct.
 */
@Service
@Slf4j
public class ClientSessionService {

    public static final String TOPIC_SESSION_STATE = "session.state";
    public static final String TOPIC_SESSION_NOTICE = "session.notice";
    public static final String TOPIC_LEDGER = "ledger.balance";

    private final SessionManager sessions;
    private final LedgerCache ledger;
    private final PositionBook book;
    private final LivePortfolioService live;
    private final LedgerGateway ledgerGateway;
    private final TradeGateway trades;
    private final SyncScheduler timers;
    private final SessionWatchdogJob watchdog;
    private final LedgerSyncJob ledgerSync;
    private final StreamGateway stream;
    private final BearerTokenDecoder decoder;
    private final SyncProperties syncProps;
    private final Duration callTimeout;
    private final Clock clock;
    private final Executor sync;

    public ClientSessionService(SessionManager sessions,
                                LedgerCache ledger,
                                PositionBook book,
                                LivePortfolioService live,
                                LedgerGateway ledgerGateway,
                                TradeGateway trades,
                                SyncScheduler timers,
                                SessionWatchdogJob watchdog,
                                LedgerSyncJob ledgerSync,
                                StreamGateway stream,
                                BearerTokenDecoder decoder,
                                SyncProperties syncProps,
                                ApiProperties apiProps,
                                Clock clock,
                                @Qualifier("syncScheduler") Executor sync) {
        this.sessions = sessions;
        this.ledger = ledger;
        this.book = book;
        this.live = live;
        this.ledgerGateway = ledgerGateway;
        this.trades = trades;
        this.timers = timers;
        this.watchdog = watchdog;
        this.ledgerSync = ledgerSync;
        this.stream = stream;
        this.decoder = decoder;
        this.syncProps = syncProps;
        this.callTimeout = apiProps.getConnectTimeout().plus(apiProps.getReadTimeout()).multipliedBy(2);
        this.clock = clock;
        this.sync = sync;
    }

    // =====================================================================
    // Session lifecycle
    // =====================================================================

    public Result<SessionView> login(AuthCredentials credentials) {
        try {
            Session s = await(sessions.authenticate(credentials));
            started(s);
            return Result.ok(view());
        } catch (Exception e) {
            return failed("login", e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeOnStartup() {
        if (!syncProps.isResumeOnStartup()) {
            return;
        }
        Result<SessionView> r = resume();
        log.info("Startup resume: {}", r.isOk() ? "session restored" : r.getError());
    }

    public Result<SessionView> resume() {
        try {
            Optional<Session> s = sessions.resume(clock.instant());
            if (s.isEmpty()) {
                return Result.fail(new NotAuthenticatedException("No persisted session to resume"));
            }
            started(s.get());
            return Result.ok(view());
        } catch (Exception e) {
            return failed("resume", e);
        }
    }

    public Result<SessionView> logout() {
        if (sessions.currentSession().isEmpty()) {
            return Result.fail(new NotAuthenticatedException());
        }
        sessions.logout();
        return Result.ok(view());
    }

    public Result<SessionView> logoutAllDevices() {
        try {
            await(sessions.logoutAllDevices());
            return Result.ok(view());
        } catch (Exception e) {
            return failed("logoutAllDevices", e);
        }
    }

    public Result<SessionView> sessionState() {
        return Result.ok(view());
    }

    private SessionView view() {
        Optional<Session> s = sessions.currentSession();
        if (s.isPresent()) {
            return SessionView.of(s.get(), sessions.state());
        }
        return SessionView.ended(sessions.state(), sessions.lastEndReason().orElse(null));
    }

    private void started(Session s) {
        if (!ledger.load(s.getPrincipalId())) {
            seedFromClaims(s);
        }
        book.load(s.getPrincipalId());
        live.start();

        timers.scheduleAtFixedRate(SessionWatchdogJob.NAME, watchdog, syncProps.getSessionCheckInterval());
        if (s.getRole() != SessionRole.SUPER_OPERATOR) {
            ledgerSync.pull().thenAccept(b -> b.ifPresent(x -> stream.send(TOPIC_LEDGER, x)));
            timers.scheduleAtFixedRate(LedgerSyncJob.NAME, ledgerSync, syncProps.getReconcileInterval());
        }
        stream.send(TOPIC_SESSION_STATE, SessionView.of(s, sessions.state()));
    }

    private void seedFromClaims(Session s) {
        try {
            TokenClaims claims = decoder.decode(s.getBearerToken());
            if (claims.getSeedBalance() != null) {
                ledger.seed(claims.getSeedBalance());
            }
        } catch (IllegalArgumentException e) {
            log.warn("No balance seed for {}: {}", s.getPrincipalId(), e.getMessage());
        }
    }

    /**
     * Stops everything tied to the ended session. Runs synchronously inside the teardown.
     */
    @EventListener
    public void onSessionEnded(SessionEndedEvent event) {
        SessionEndReason reason = event.reason();
        timers.cancelAll();
        live.stop();
        ledger.clear(reason.clearsPersistedState());
        book.unload();

        boolean takeover = reason == SessionEndReason.CONCURRENT_SESSION;
        stream.send(TOPIC_SESSION_NOTICE, new SessionNotice(event.session().getPrincipalId(), reason,
                takeover, reason.getNotice(), event.at()));
        log.info("Session of {} ended ({}), local state released", event.session().getPrincipalId(), reason);
    }

    // =====================================================================
    // Ledger
    // =====================================================================

    public Result<LedgerBalance> balance() {
        try {
            sessions.requireSession();
            return Result.ok(ledger.balance());
        } catch (Exception e) {
            return failed("balance", e);
        }
    }

    public Result<BigDecimal> coinBalance() {
        return balance().map(LedgerBalance::getRewardAmount);
    }

    public Result<BigDecimal> walletBalance() {
        return balance().map(LedgerBalance::getWalletAmount);
    }

    public Result<LedgerBalance> deductCoins(BigDecimal amount, String reason, String relatedTradeId) {
        return coinDelta(DeltaKind.DEBIT, amount, reason, relatedTradeId);
    }

    public Result<LedgerBalance> addCoins(BigDecimal amount, String reason, String relatedTradeId) {
        return coinDelta(DeltaKind.CREDIT, amount, reason, relatedTradeId);
    }

    private Result<LedgerBalance> coinDelta(DeltaKind kind, BigDecimal amount, String reason, String relatedTradeId) {
        try {
            Session s = sessions.requireSession();
            checkTransactionAmount(amount);
            String why = (reason == null || reason.isBlank()) ? LedgerConstants.REASON_ADJUSTMENT : reason;

            LedgerBalance updated = ledger.applyOptimisticDelta(LedgerAccount.REWARD, kind, amount, why);
            book.record(Transaction.builder()
                    .id(UUID.randomUUID().toString())
                    .kind(kind == DeltaKind.DEBIT ? TransactionKind.DEBIT : TransactionKind.CREDIT)
                    .amount(amount)
                    .timestamp(clock.instant())
                    .reason(why)
                    .relatedTradeId(relatedTradeId)
                    .build());
            stream.send(TOPIC_LEDGER, updated);

            LedgerDeltaRequest req = LedgerDeltaRequest.builder()
                    .userId(s.getPrincipalId())
                    .amount(amount)
                    .reason(why)
                    .relatedTradeId(relatedTradeId)
                    .build();
            forward(kind, req, s);
            return Result.ok(updated);
        } catch (Exception e) {
            return failed(kind == DeltaKind.DEBIT ? "deductCoins" : "addCoins", e);
        }
    }

    private void forward(DeltaKind kind, LedgerDeltaRequest req, Session s) {
        CompletableFuture<Void> call;
        try {
            call = kind == DeltaKind.DEBIT
                    ? ledgerGateway.debit(req, s.getBearerToken())
                    : ledgerGateway.credit(req, s.getBearerToken());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenCompleteAsync((v, err) -> {
            if (err != null) {
                log.warn("Server {} of {} failed; next reconciliation will correct the cache: {}",
                        kind, req.getAmount(), err.getMessage());
            }
        }, sync);
    }

    public Result<BalanceCheck> validateSufficientCoins(BigDecimal amount) {
        try {
            sessions.requireSession();
            return Result.ok(ledger.validateSufficientBalance(LedgerAccount.REWARD, amount));
        } catch (Exception e) {
            return failed("validateSufficientCoins", e);
        }
    }

    private static void checkTransactionAmount(BigDecimal amount) {
        if (amount == null
                || amount.compareTo(LedgerConstants.MIN_TRANSACTION_AMOUNT) < 0
                || amount.compareTo(LedgerConstants.MAX_TRANSACTION_AMOUNT) > 0) {
            throw new ValidationException("Amount must be between "
                    + LedgerConstants.MIN_TRANSACTION_AMOUNT + " and " + LedgerConstants.MAX_TRANSACTION_AMOUNT);
        }
    }

    // =====================================================================
    // Trading
    // =====================================================================

    /**
     * Reserves the cost on the wallet, submits, and journals the BUY once the server confirms.
     * A rejected trade gets the reservation back as a refund credit.
     */
    public Result<Transaction> buyStock(String symbol, long quantity, BigDecimal price) {
        try {
            Session s = sessions.requireSession();
            String sym = checkTrade(symbol, quantity, price);
            BigDecimal total = price.multiply(BigDecimal.valueOf(quantity));

            BalanceCheck check = ledger.validateSufficientBalance(LedgerAccount.WALLET, total);
            if (!check.isSufficient()) {
                throw new InsufficientBalanceException(LedgerAccount.WALLET, check.getCurrentBalance(), total);
            }
            ledger.applyOptimisticDelta(LedgerAccount.WALLET, DeltaKind.DEBIT, total, LedgerConstants.REASON_TRADE_BUY);

            TradeOrder order = order(s, sym, TransactionKind.BUY, quantity, price, total);
            CompletableFuture<Transaction> settled = submit(order, s).handleAsync((tradeId, err) -> {
                if (err != null) {
                    if (sessions.isCurrent(s.getInstanceId())) {
                        ledger.applyOptimisticDelta(LedgerAccount.WALLET, DeltaKind.CREDIT, total, LedgerConstants.REASON_REFUND);
                        stream.send(TOPIC_LEDGER, ledger.balance());
                    }
                    throw new CompletionException(unwrap(err));
                }
                return settle(s, order, tradeId);
            }, sync);
            return Result.ok(await(settled));
        } catch (Exception e) {
            return failed("buyStock", e);
        }
    }

    public Result<Transaction> sellStock(String symbol, long quantity, BigDecimal price) {
        try {
            Session s = sessions.requireSession();
            String sym = checkTrade(symbol, quantity, price);
            long held = book.position(sym).map(Position::getQuantity).orElse(0L);
            if (quantity > held) {
                throw new InsufficientQuantityException(sym, held, quantity);
            }
            BigDecimal total = price.multiply(BigDecimal.valueOf(quantity));

            TradeOrder order = order(s, sym, TransactionKind.SELL, quantity, price, total);
            CompletableFuture<Transaction> settled = submit(order, s).handleAsync((tradeId, err) -> {
                if (err != null) {
                    throw new CompletionException(unwrap(err));
                }
                return settle(s, order, tradeId);
            }, sync);
            return Result.ok(await(settled));
        } catch (Exception e) {
            return failed("sellStock", e);
        }
    }

    private CompletableFuture<String> submit(TradeOrder order, Session s) {
        try {
            return trades.submit(order, s.getBearerToken());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // runs on the sync thread once the server confirmed the trade
    private Transaction settle(Session s, TradeOrder order, String tradeId) {
        if (!sessions.isCurrent(s.getInstanceId())) {
            throw new NotAuthenticatedException("Session ended before trade " + tradeId + " was confirmed");
        }
        Transaction tx = Transaction.builder()
                .id(UUID.randomUUID().toString())
                .kind(order.getType())
                .instrumentSymbol(order.getSymbol())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .amount(order.getTotal())
                .timestamp(order.getTimestamp())
                .reason(order.getType() == TransactionKind.BUY ? LedgerConstants.REASON_TRADE_BUY : LedgerConstants.REASON_TRADE_SELL)
                .relatedTradeId(tradeId)
                .build();
        // journal first: an overlapping sell may already have closed the position
        book.record(tx);
        if (order.getType() == TransactionKind.SELL) {
            ledger.applyOptimisticDelta(LedgerAccount.WALLET, DeltaKind.CREDIT, order.getTotal(), LedgerConstants.REASON_TRADE_SELL);
        }
        live.positionsChanged();
        stream.send(TOPIC_LEDGER, ledger.balance());
        log.info("{} {} x{} @ {} confirmed (trade {})", order.getType(), order.getSymbol(),
                order.getQuantity(), order.getPrice().toPlainString(), tradeId);
        return tx;
    }

    private TradeOrder order(Session s, String sym, TransactionKind kind, long qty, BigDecimal price, BigDecimal total) {
        return TradeOrder.builder()
                .userId(s.getPrincipalId())
                .symbol(sym)
                .type(kind)
                .quantity(qty)
                .price(price)
                .total(total)
                .timestamp(clock.instant())
                .build();
    }

    private static String checkTrade(String symbol, long quantity, BigDecimal price) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Symbol is required");
        }
        if (quantity <= 0) {
            throw new ValidationException("Quantity must be positive");
        }
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Price must be positive");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    // =====================================================================
    // Portfolio
    // =====================================================================

    public Result<PortfolioValuation> portfolio() {
        try {
            sessions.requireSession();
            return Result.ok(live.current());
        } catch (Exception e) {
            return failed("portfolio", e);
        }
    }

    /**
     * Newest first.
     */
    public Result<List<Transaction>> transactions() {
        try {
            sessions.requireSession();
            List<Transaction> out = new ArrayList<>(book.transactions());
            Collections.reverse(out);
            return Result.ok(out);
        } catch (Exception e) {
            return failed("transactions", e);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private <T> T await(CompletableFuture<T> f) {
        try {
            return f.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while waiting for the server", e);
        } catch (TimeoutException e) {
            throw new GatewayException("No response from the server within " + callTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new GatewayException(cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private <T> Result<T> failed(String op, Exception e) {
        if (e instanceof BaseClientException) {
            log.warn("{} failed: {}", op, e.getMessage());
        } else {
            log.error("{} failed", op, e);
        }
        return Result.fail(e);
    }
}
