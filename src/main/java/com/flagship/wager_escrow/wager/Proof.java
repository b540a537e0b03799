package com.flagship.wager_escrow.wager;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One participant's claim about who won, with supporting evidence.
 *
 * Proofs are append-only. {@code sequence} orders submissions within a wager;
 * the lowest sequence is the "original" claim a dispute contests.
 */
@Value
public class Proof {
    UUID id;
    UUID wagerId;
    UUID submitterId;
    UUID claimedWinnerId;
    String evidenceUrl;
    EvidenceType evidenceType;
    Instant submittedAt;
    Long sequence;

    public static Proof submit(UUID wagerId, UUID submitterId, UUID claimedWinnerId,
                               String evidenceUrl, EvidenceType evidenceType, Instant now) {
        return new Proof(UUID.randomUUID(), wagerId, submitterId, claimedWinnerId,
                evidenceUrl, evidenceType, now, null);
    }

    public boolean agreesWith(Proof other) {
        return claimedWinnerId.equals(other.claimedWinnerId);
    }
}
