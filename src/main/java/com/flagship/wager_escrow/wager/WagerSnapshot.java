package com.flagship.wager_escrow.wager;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read view of a wager with its proofs and dispute, plus flags derived from
 * the clock at read time.
 */
@Value
public class WagerSnapshot {
    Wager wager;
    List<Proof> proofs;
    Dispute dispute;
    boolean expired;
    boolean canDispute;
    Instant disputeDeadline;
}
