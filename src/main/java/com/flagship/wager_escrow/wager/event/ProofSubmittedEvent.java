package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.EvidenceType;
import com.flagship.wager_escrow.wager.Proof;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A participant claimed a winner. {@code firstProof} is true when this proof
 * opened the dispute window.
 */
@Value
public class ProofSubmittedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    UUID proofId;
    UUID submitterId;
    UUID claimedWinnerId;
    EvidenceType evidenceType;
    boolean firstProof;
    Instant disputeDeadline;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProofSubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ProofSubmittedEvent fromProof(Proof proof, boolean firstProof, Instant disputeDeadline) {
        return new ProofSubmittedEvent(
            UUID.randomUUID(),
            proof.getWagerId(),
            proof.getId(),
            proof.getSubmitterId(),
            proof.getClaimedWinnerId(),
            proof.getEvidenceType(),
            firstProof,
            disputeDeadline,
            proof.getSubmittedAt()
        );
    }
}
