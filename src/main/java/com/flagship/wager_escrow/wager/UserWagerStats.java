package com.flagship.wager_escrow.wager;

import lombok.Value;

import java.util.UUID;

/**
 * Per-user wager record. {@code winRate} is a percentage with one decimal,
 * counted over settled wagers that had a winner.
 */
@Value
public class UserWagerStats {
    UUID userId;
    long created;
    long accepted;
    long won;
    long lost;
    double winRate;
    long totalEarnings;
    long totalWagered;

    public static UserWagerStats from(UUID userId, WagerTotals totals) {
        long decided = totals.getDecided();
        long lost = Math.max(0, decided - totals.getWon());
        double winRate = decided == 0 ? 0.0 : Math.round(totals.getWon() * 1000.0 / decided) / 10.0;
        return new UserWagerStats(userId, totals.getCreated(), totals.getAccepted(), totals.getWon(), lost,
                winRate, totals.getTotalEarnings(), totals.getTotalWagered());
    }
}
