package com.flagship.wager_escrow.wager;

import lombok.Value;

/**
 * Raw per-user aggregates over the wager table.
 */
@Value
public class WagerTotals {
    long created;
    long accepted;
    long won;
    long decided;
    long totalEarnings;
    long totalWagered;
}
