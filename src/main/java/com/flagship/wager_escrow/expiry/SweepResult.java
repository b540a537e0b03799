package com.flagship.wager_escrow.expiry;

import lombok.Value;

/**
 * Counts from one sweeper run.
 */
@Value
public class SweepResult {
    int expired;
    int finalized;
    int skipped;
    int failed;

    public static SweepResult empty() {
        return new SweepResult(0, 0, 0, 0);
    }

    public int total() {
        return expired + finalized + skipped + failed;
    }
}
