package com.flagship.wager_escrow.wager;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * What the submitted proofs say about the outcome.
 * {@code winnerId} is set only for {@link Kind#AGREED}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProofConsensus {

    public enum Kind {
        AWAITING_SECOND_PROOF,
        AGREED,
        CONFLICTING
    }

    Kind kind;
    UUID winnerId;

    public static ProofConsensus awaitingSecondProof() {
        return new ProofConsensus(Kind.AWAITING_SECOND_PROOF, null);
    }

    public static ProofConsensus agreed(UUID winnerId) {
        return new ProofConsensus(Kind.AGREED, winnerId);
    }

    public static ProofConsensus conflicting() {
        return new ProofConsensus(Kind.CONFLICTING, null);
    }

    public boolean isAgreed() {
        return kind == Kind.AGREED;
    }
}
