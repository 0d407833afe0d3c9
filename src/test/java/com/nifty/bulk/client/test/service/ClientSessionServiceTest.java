package com.nifty.bulk.client.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.common.Result;
import com.nifty.bulk.client.common.constants.ApiProperties;
import com.nifty.bulk.client.common.constants.SyncProperties;
import com.nifty.bulk.client.common.exception.AuthFailureException;
import com.nifty.bulk.client.common.exception.GatewayException;
import com.nifty.bulk.client.config.CustomConfig;
import com.nifty.bulk.client.core.InMemoryStateStore;
import com.nifty.bulk.client.core.StateStore;
import com.nifty.bulk.client.enums.SessionEndReason;
import com.nifty.bulk.client.enums.SessionState;
import com.nifty.bulk.client.enums.TransactionKind;
import com.nifty.bulk.client.model.AuthCredentials;
import com.nifty.bulk.client.model.LedgerBalance;
import com.nifty.bulk.client.model.PortfolioValuation;
import com.nifty.bulk.client.model.SessionNotice;
import com.nifty.bulk.client.model.SessionView;
import com.nifty.bulk.client.model.TradeOrder;
import com.nifty.bulk.client.model.Transaction;
import com.nifty.bulk.client.service.ClientSessionService;
import com.nifty.bulk.client.service.SyncScheduler;
import com.nifty.bulk.client.service.feed.PriceFeedSubscriber;
import com.nifty.bulk.client.service.gateway.AuthGateway;
import com.nifty.bulk.client.service.gateway.InProcessPriceFeed;
import com.nifty.bulk.client.service.gateway.LedgerGateway;
import com.nifty.bulk.client.service.gateway.TradeGateway;
import com.nifty.bulk.client.service.jobs.LedgerSyncJob;
import com.nifty.bulk.client.service.jobs.SessionWatchdogJob;
import com.nifty.bulk.client.service.ledger.LedgerCache;
import com.nifty.bulk.client.service.portfolio.LivePortfolioService;
import com.nifty.bulk.client.service.portfolio.PortfolioValuationEngine;
import com.nifty.bulk.client.service.portfolio.PositionBook;
import com.nifty.bulk.client.service.session.BearerTokenDecoder;
import com.nifty.bulk.client.service.session.SessionEndedEvent;
import com.nifty.bulk.client.service.session.SessionManager;
import com.nifty.bulk.client.service.streaming.StreamGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.nifty.bulk.client.test.TestTokens.token;
import static com.nifty.bulk.client.test.TestTokens.tokenWithBalances;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClientSessionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final AuthCredentials CREDS = AuthCredentials.mobileOtp("9876543210", "123456");

    private final ObjectMapper mapper = new CustomConfig().mapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Executor direct = Runnable::run;

    private StateStore store;
    private AuthGateway auth;
    private LedgerGateway ledgerGateway;
    private TradeGateway trades;
    private SyncScheduler timers;
    private StreamGateway stream;
    private InProcessPriceFeed connection;
    private SessionManager sessions;
    private ClientSessionService client;

    private final String loginToken = tokenWithBalances("u1", NOW.plus(Duration.ofHours(1)), "10000", "250");

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        auth = mock(AuthGateway.class);
        ledgerGateway = mock(LedgerGateway.class);
        trades = mock(TradeGateway.class);
        timers = mock(SyncScheduler.class);
        stream = mock(StreamGateway.class);
        connection = new InProcessPriceFeed();

        BearerTokenDecoder decoder = new BearerTokenDecoder(mapper);
        SyncProperties syncProps = new SyncProperties();
        syncProps.setResumeOnStartup(false);

        sessions = new SessionManager(store, auth, decoder, syncProps, clock, direct,
                event -> client.onSessionEnded((SessionEndedEvent) event));
        LedgerCache ledger = new LedgerCache(store, mapper, clock);
        PositionBook book = new PositionBook(store, mapper);
        PriceFeedSubscriber feed = new PriceFeedSubscriber(connection);
        feed.open();
        LivePortfolioService live = new LivePortfolioService(book, feed, new PortfolioValuationEngine(), stream);
        SessionWatchdogJob watchdog = new SessionWatchdogJob(sessions, clock);
        LedgerSyncJob ledgerSync = new LedgerSyncJob(sessions, ledger, ledgerGateway, direct);

        client = new ClientSessionService(sessions, ledger, book, live, ledgerGateway, trades, timers, watchdog,
                ledgerSync, stream, decoder, syncProps, new ApiProperties(), clock, direct);

        when(auth.authenticate(any())).thenReturn(CompletableFuture.completedFuture(loginToken));
        // the startup pull stays in flight so the seeded balance is what the tests see
        when(ledgerGateway.fetchSnapshot(anyString(), anyString())).thenReturn(new CompletableFuture<>());
        when(ledgerGateway.debit(any(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(ledgerGateway.credit(any(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    private void login() {
        assertThat(client.login(CREDS).isOk()).isTrue();
    }

    @Test
    void loginSeedsLedgerFromClaimsAndStartsTimers() {
        Result<SessionView> r = client.login(CREDS);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getPrincipalId()).isEqualTo("u1");
        assertThat(r.get().getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(client.walletBalance().get()).isEqualByComparingTo("10000");
        assertThat(client.coinBalance().get()).isEqualByComparingTo("250");
        verify(timers).scheduleAtFixedRate(eq(SessionWatchdogJob.NAME), any(), eq(Duration.ofSeconds(60)));
        verify(timers).scheduleAtFixedRate(eq(LedgerSyncJob.NAME), any(), eq(Duration.ofSeconds(5)));
        verify(ledgerGateway).fetchSnapshot("u1", loginToken);
    }

    @Test
    void failedLoginSurfacesAuthError() {
        when(auth.authenticate(any())).thenReturn(CompletableFuture.failedFuture(new AuthFailureException("Invalid OTP")));

        Result<SessionView> r = client.login(CREDS);

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("ERR-AUTH-001");
        assertThat(client.sessionState().get().getState()).isEqualTo(SessionState.UNAUTHENTICATED);
    }

    @Test
    void superOperatorDoesNotPollLedger() {
        when(auth.authenticate(any())).thenReturn(CompletableFuture.completedFuture(
                token("root", "superadmin", NOW.plus(Duration.ofHours(1)))));

        assertThat(client.login(AuthCredentials.superOperator("root@x", "pw")).isOk()).isTrue();

        verify(timers, never()).scheduleAtFixedRate(eq(LedgerSyncJob.NAME), any(), any());
        verify(ledgerGateway, never()).fetchSnapshot(anyString(), anyString());
    }

    @Test
    void callsWithoutSessionFailWithNotAuthenticated() {
        assertThat(client.balance().getErrorCode()).isEqualTo("ERR-AUTH-003");
        assertThat(client.buyStock("TCS", 1, BigDecimal.TEN).getErrorCode()).isEqualTo("ERR-AUTH-003");
        assertThat(client.resume().getErrorCode()).isEqualTo("ERR-AUTH-003");
        assertThat(client.logout().getErrorCode()).isEqualTo("ERR-AUTH-003");
    }

    @Test
    void buyBeyondWalletIsRejectedBeforeSubmitting() {
        login();

        Result<Transaction> r = client.buyStock("RELIANCE", 5, new BigDecimal("2500"));

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("ERR-BAL-001");
        verify(trades, never()).submit(any(), anyString());
        assertThat(client.walletBalance().get()).isEqualByComparingTo("10000");
    }

    @Test
    void confirmedBuyDebitsWalletAndOpensPosition() {
        login();
        when(trades.submit(any(), eq(loginToken))).thenReturn(CompletableFuture.completedFuture("T-1"));

        Result<Transaction> r = client.buyStock("reliance", 2, new BigDecimal("2450"));

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getKind()).isEqualTo(TransactionKind.BUY);
        assertThat(r.get().getInstrumentSymbol()).isEqualTo("RELIANCE");
        assertThat(r.get().getRelatedTradeId()).isEqualTo("T-1");
        assertThat(client.walletBalance().get()).isEqualByComparingTo("5100");

        PortfolioValuation v = client.portfolio().get();
        assertThat(v.getPositions()).hasSize(1);
        assertThat(v.getTotalInvestment()).isEqualByComparingTo("4900");
        assertThat(connection.isSubscribed("RELIANCE")).isTrue();
    }

    @Test
    void rejectedBuyRefundsTheReservation() {
        login();
        when(trades.submit(any(), anyString())).thenReturn(CompletableFuture.failedFuture(new GatewayException("rejected")));

        Result<Transaction> r = client.buyStock("TCS", 1, new BigDecimal("3800"));

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("ERR-NET-001");
        assertThat(client.walletBalance().get()).isEqualByComparingTo("10000");
        assertThat(client.transactions().get()).isEmpty();
    }

    @Test
    void sellCreditsProceedsAndShrinksPosition() {
        login();
        when(trades.submit(any(), anyString())).thenReturn(CompletableFuture.completedFuture("T-1"));
        client.buyStock("INFY", 10, new BigDecimal("100"));

        Result<Transaction> r = client.sellStock("INFY", 4, new BigDecimal("150"));

        assertThat(r.isOk()).isTrue();
        assertThat(client.walletBalance().get()).isEqualByComparingTo("9600");
        assertThat(client.portfolio().get().getPositions().get(0).getQuantity()).isEqualTo(6);
        List<Transaction> history = client.transactions().get();
        assertThat(history).extracting(Transaction::getKind).containsExactly(TransactionKind.SELL, TransactionKind.BUY);
    }

    @Test
    void sellingMoreThanHeldIsRejected() {
        login();

        Result<Transaction> r = client.sellStock("INFY", 1, new BigDecimal("150"));

        assertThat(r.getErrorCode()).isEqualTo("ERR-BAL-002");
        verify(trades, never()).submit(any(), anyString());
    }

    @Test
    void deductCoinsAppliesLocallyAndForwards() {
        login();

        Result<LedgerBalance> r = client.deductCoins(new BigDecimal("50"), "Trade Purchase", "T-9");

        assertThat(r.isOk()).isTrue();
        assertThat(client.coinBalance().get()).isEqualByComparingTo("200");
        verify(ledgerGateway).debit(argThat(req -> req.getAmount().compareTo(new BigDecimal("50")) == 0
                && "u1".equals(req.getUserId()) && "T-9".equals(req.getRelatedTradeId())), eq(loginToken));
        assertThat(client.transactions().get()).extracting(Transaction::getKind).containsExactly(TransactionKind.DEBIT);
    }

    @Test
    void failedForwardKeepsOptimisticBalance() {
        login();
        when(ledgerGateway.credit(any(), anyString())).thenReturn(CompletableFuture.failedFuture(new GatewayException("down")));

        Result<LedgerBalance> r = client.addCoins(new BigDecimal("10"), null, null);

        assertThat(r.isOk()).isTrue();
        assertThat(client.coinBalance().get()).isEqualByComparingTo("260");
    }

    @Test
    void coinLimitsAndBalanceAreEnforced() {
        login();

        assertThat(client.deductCoins(new BigDecimal("300"), null, null).getErrorCode()).isEqualTo("ERR-BAL-001");
        assertThat(client.addCoins(new BigDecimal("50001"), null, null).getErrorCode()).isEqualTo("ERR-VAL-001");
        assertThat(client.addCoins(new BigDecimal("0.5"), null, null).getErrorCode()).isEqualTo("ERR-VAL-001");
        assertThat(client.validateSufficientCoins(new BigDecimal("300")).get().isSufficient()).isFalse();
        assertThat(client.validateSufficientCoins(new BigDecimal("250")).get().isSufficient()).isTrue();
    }

    @Test
    void takeoverReleasesLocalStateButKeepsPersistedLedger() {
        login();
        SessionManager elsewhere = new SessionManager(store, auth, new BearerTokenDecoder(mapper),
                new SyncProperties(), clock, direct, event -> { });
        when(auth.authenticate(any())).thenReturn(CompletableFuture.completedFuture(
                token("u1", "user", NOW.plus(Duration.ofHours(2)))));
        elsewhere.authenticate(CREDS).join();

        assertThat(sessions.detectConcurrentSession()).isTrue();

        SessionView view = client.sessionState().get();
        assertThat(view.getState()).isEqualTo(SessionState.INVALIDATED);
        assertThat(view.getEndReason()).isEqualTo(SessionEndReason.CONCURRENT_SESSION);
        assertThat(view.getNotice()).contains("logged in from another device");
        verify(timers).cancelAll();
        verify(stream).send(eq(ClientSessionService.TOPIC_SESSION_NOTICE),
                argThat(n -> n instanceof SessionNotice && ((SessionNotice) n).takeover()));
        assertThat(client.balance().getErrorCode()).isEqualTo("ERR-AUTH-003");
        assertThat(store.namespace("ledger").keys("u1:")).isNotEmpty();
    }

    @Test
    void logoutPurgesLedgerButKeepsJournal() {
        login();
        when(trades.submit(any(), anyString())).thenReturn(CompletableFuture.completedFuture("T-1"));
        client.buyStock("TCS", 1, new BigDecimal("100"));

        Result<SessionView> r = client.logout();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().getEndReason()).isEqualTo(SessionEndReason.LOGOUT);
        assertThat(store.namespace("ledger").keys("u1:")).isEmpty();
        assertThat(store.namespace("portfolio").get("u1:journal")).isPresent();
        assertThat(store.namespace("session").keys("")).isEmpty();
        assertThat(connection.isSubscribed("TCS")).isFalse();
    }

    @Test
    void relogAfterLogoutRestoresJournalAndSeedsLedgerAgain() {
        login();
        when(trades.submit(any(), anyString())).thenReturn(CompletableFuture.completedFuture("T-1"));
        client.buyStock("TCS", 1, new BigDecimal("100"));
        client.logout();

        login();

        assertThat(client.portfolio().get().getPositions()).hasSize(1);
        assertThat(client.walletBalance().get()).isEqualByComparingTo("10000");
    }

    @Test
    void overlappingSellsOfOnePositionCreditOnlyTheJournaledSale() throws Exception {
        login();
        when(trades.submit(argThat(o -> o != null && o.getType() == TransactionKind.BUY), anyString()))
                .thenReturn(CompletableFuture.completedFuture("T-BUY"));
        client.buyStock("INFY", 10, new BigDecimal("100"));

        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();
        when(trades.submit(argThat(o -> o != null && o.getType() == TransactionKind.SELL), anyString()))
                .thenReturn(first, second);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<Result<Transaction>> a = callers.submit(() -> client.sellStock("INFY", 10, new BigDecimal("150")));
            Future<Result<Transaction>> b = callers.submit(() -> client.sellStock("INFY", 10, new BigDecimal("150")));
            // both pass the held-quantity check before either is confirmed
            verify(trades, timeout(5000).times(2))
                    .submit(argThat((TradeOrder o) -> o != null && o.getType() == TransactionKind.SELL), anyString());

            first.complete("T-S1");
            second.complete("T-S2");

            List<Result<Transaction>> results = List.of(a.get(10, TimeUnit.SECONDS), b.get(10, TimeUnit.SECONDS));
            assertThat(results).filteredOn(Result::isOk).hasSize(1);
            assertThat(results).filteredOn(r -> !r.isOk())
                    .extracting(Result::getErrorCode).containsExactly("ERR-BAL-002");
        } finally {
            callers.shutdownNow();
        }

        assertThat(client.walletBalance().get()).isEqualByComparingTo("10500");
        assertThat(client.transactions().get()).extracting(Transaction::getKind)
                .containsExactly(TransactionKind.SELL, TransactionKind.BUY);
        assertThat(client.portfolio().get().getPositions()).isEmpty();
    }
}
