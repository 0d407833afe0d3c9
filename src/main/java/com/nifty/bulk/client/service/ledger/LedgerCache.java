package com.nifty.bulk.client.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.common.constants.LedgerConstants;
import com.nifty.bulk.client.common.constants.StoreNamespaces;
import com.nifty.bulk.client.common.exception.InsufficientBalanceException;
import com.nifty.bulk.client.common.exception.NotAuthenticatedException;
import com.nifty.bulk.client.common.exception.ReconciliationException;
import com.nifty.bulk.client.common.exception.ValidationException;
import com.nifty.bulk.client.core.NamespacedStateStore;
import com.nifty.bulk.client.core.StateStore;
import com.nifty.bulk.client.core.StateStoreException;
import com.nifty.bulk.client.enums.DeltaKind;
import com.nifty.bulk.client.enums.LedgerAccount;
import com.nifty.bulk.client.model.BalanceCheck;
import com.nifty.bulk.client.model.LedgerBalance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Local copy of the principal's wallet and reward balances.
 * <p>
 * Two views are kept: the optimistic balance (last snapshot plus local deltas), which is what
 * the UI shows, and the last authoritative snapshot, which balance checks run against.
 * A reconcile replaces both wholesale. All mutations are serialized on this instance.
 */
@Service
@Slf4j
public class LedgerCache {

    private static final String BALANCE = ":balance";
    private static final String AUTHORITATIVE = ":authoritative";

    private final NamespacedStateStore persisted;
    private final ObjectMapper mapper;
    private final Clock clock;

    private String principalId;
    private LedgerBalance cached = LedgerBalance.empty();
    private LedgerBalance authoritative = LedgerBalance.empty();

    public LedgerCache(StateStore store, ObjectMapper mapper, Clock clock) {
        this.persisted = store.namespace(StoreNamespaces.LEDGER);
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Binds the cache to a principal and restores whatever was persisted for it.
     *
     * @return true when a persisted balance was found
     */
    public synchronized boolean load(String principalId) {
        this.principalId = principalId;
        Optional<LedgerBalance> b = read(principalId + BALANCE);
        Optional<LedgerBalance> a = read(principalId + AUTHORITATIVE);
        this.cached = b.orElse(LedgerBalance.empty());
        this.authoritative = a.orElse(this.cached);
        log.info("Ledger loaded for {} (persisted: {})", principalId, b.isPresent());
        return b.isPresent();
    }

    /**
     * Initial balance from token claims, used when nothing was persisted yet.
     */
    public synchronized void seed(LedgerBalance balance) {
        requireLoaded();
        if (balance == null || balance.hasNegativeAmount()) {
            log.warn("Ignoring seed balance with negative or missing amounts");
            return;
        }
        persist(balance, balance);
        this.cached = balance;
        this.authoritative = balance;
    }

    /**
     * Applies a local delta ahead of server confirmation. A debit larger than the current
     * amount fails and changes nothing.
     */
    public synchronized LedgerBalance applyOptimisticDelta(LedgerAccount account, DeltaKind kind,
                                                           BigDecimal amount, String reason) {
        requireLoaded();
        if (account == null || kind == null) {
            throw new ValidationException("Account and delta kind are required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }

        BigDecimal currentAmount = cached.amountOf(account);
        LedgerBalance.LedgerBalanceBuilder next = cached.toBuilder().asOf(clock.instant());
        if (kind == DeltaKind.DEBIT) {
            if (currentAmount.compareTo(amount) < 0) {
                throw new InsufficientBalanceException(account, currentAmount, amount);
            }
            setAmount(next, account, currentAmount.subtract(amount));
        } else {
            setAmount(next, account, currentAmount.add(amount));
            if (account == LedgerAccount.REWARD) {
                if (LedgerConstants.REASON_PURCHASE.equals(reason)) {
                    next.totalRewardPurchased(cached.getTotalRewardPurchased().add(amount));
                } else {
                    next.totalRewardEarned(cached.getTotalRewardEarned().add(amount));
                }
            }
        }

        LedgerBalance updated = next.build();
        persist(updated, authoritative);
        this.cached = updated;
        log.debug("Ledger {} {} {} ({}) -> {}", kind, account, amount.toPlainString(), reason,
                cached.amountOf(account).toPlainString());
        return cached;
    }

    private static void setAmount(LedgerBalance.LedgerBalanceBuilder b, LedgerAccount account, BigDecimal value) {
        if (account == LedgerAccount.WALLET) {
            b.walletAmount(value);
        } else {
            b.rewardAmount(value);
        }
    }

    /**
     * Server wins: the snapshot replaces the cached balance, discarding optimistic deltas.
     * A snapshot with a negative amount is rejected and the cache kept.
     */
    public synchronized LedgerBalance reconcile(LedgerBalance snapshot) {
        requireLoaded();
        if (snapshot == null || snapshot.hasNegativeAmount()) {
            throw new ReconciliationException("Rejected ledger snapshot with negative or missing amounts");
        }
        LedgerBalance stamped = snapshot.getAsOf() == null
                ? snapshot.toBuilder().asOf(clock.instant()).build()
                : snapshot;
        if (!stamped.getWalletAmount().equals(cached.getWalletAmount())
                || !stamped.getRewardAmount().equals(cached.getRewardAmount())) {
            log.debug("Reconciled ledger for {}: wallet {} -> {}, reward {} -> {}", principalId,
                    cached.getWalletAmount(), stamped.getWalletAmount(),
                    cached.getRewardAmount(), stamped.getRewardAmount());
        }
        persist(stamped, stamped);
        this.cached = stamped;
        this.authoritative = stamped;
        return cached;
    }

    /**
     * Read-only; checks the last authoritative snapshot, not the optimistic balance.
     */
    public synchronized BalanceCheck validateSufficientBalance(LedgerAccount account, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        BigDecimal have = authoritative.amountOf(account);
        return new BalanceCheck(account, have, amount, have.compareTo(amount) >= 0);
    }

    public synchronized LedgerBalance balance() {
        return cached;
    }

    public synchronized LedgerBalance authoritativeBalance() {
        return authoritative;
    }

    public synchronized Optional<String> principalId() {
        return Optional.ofNullable(principalId);
    }

    /**
     * Drops in-memory state; with {@code purgePersisted} also the principal's persisted keys.
     */
    public synchronized void clear(boolean purgePersisted) {
        if (purgePersisted && principalId != null) {
            persisted.deleteAll(principalId + ":");
        }
        log.info("Ledger cleared for {} (persisted purged: {})", principalId, purgePersisted);
        this.principalId = null;
        this.cached = LedgerBalance.empty();
        this.authoritative = LedgerBalance.empty();
    }

    private void requireLoaded() {
        if (principalId == null) {
            throw new NotAuthenticatedException("Ledger is not loaded for any principal");
        }
    }

    private void persist(LedgerBalance balance, LedgerBalance snapshot) {
        try {
            persisted.put(principalId + BALANCE, mapper.writeValueAsString(balance));
            persisted.put(principalId + AUTHORITATIVE, mapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Cannot serialize ledger balance", e);
        }
    }

    private Optional<LedgerBalance> read(String key) {
        Optional<String> raw = persisted.get(key);
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(raw.get(), LedgerBalance.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable persisted ledger entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
