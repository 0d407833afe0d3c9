package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.LedgerAccount;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerBalance {

    @Builder.Default
    BigDecimal walletAmount = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal rewardAmount = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal totalRewardEarned = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal totalRewardPurchased = BigDecimal.ZERO;

    Instant asOf;

    public static LedgerBalance empty() {
        return LedgerBalance.builder().build();
    }

    public BigDecimal amountOf(LedgerAccount account) {
        return account == LedgerAccount.WALLET ? walletAmount : rewardAmount;
    }

    public boolean hasNegativeAmount() {
        return isNegative(walletAmount) || isNegative(rewardAmount)
                || isNegative(totalRewardEarned) || isNegative(totalRewardPurchased);
    }

    private static boolean isNegative(BigDecimal v) {
        return v == null || v.signum() < 0;
    }
}
