package com.flagship.wager_escrow.wager;

import lombok.Value;

/**
 * Winner payout and platform fee for a stake. Always {@code payout + fee == stake}.
 */
@Value
public class SettlementSplit {

    private static final long BASIS_POINTS = 10_000;

    long payout;
    long fee;

    /**
     * {@code payout = floor(stake * (10000 - feeBps) / 10000)}; the rounding remainder goes to the fee.
     */
    public static SettlementSplit of(long stake, int feeBasisPoints) {
        if (stake <= 0) {
            throw new IllegalArgumentException("Stake must be positive: " + stake);
        }
        if (feeBasisPoints < 0 || feeBasisPoints > BASIS_POINTS) {
            throw new IllegalArgumentException("Fee basis points out of range: " + feeBasisPoints);
        }
        long payout = Math.multiplyExact(stake, BASIS_POINTS - feeBasisPoints) / BASIS_POINTS;
        return new SettlementSplit(payout, stake - payout);
    }
}
