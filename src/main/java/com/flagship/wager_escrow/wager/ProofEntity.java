package com.flagship.wager_escrow.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only proof log. One row per participant per wager.
 */
@Entity
@Table(
    name = "wager_proofs",
    uniqueConstraints = @UniqueConstraint(name = "uq_wager_proofs_submitter", columnNames = {"wager_id", "submitter_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProofEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wager_id", nullable = false, updatable = false)
    private UUID wagerId;

    @Column(name = "submitter_id", nullable = false, updatable = false)
    private UUID submitterId;

    @Column(name = "claimed_winner_id", nullable = false, updatable = false)
    private UUID claimedWinnerId;

    @Column(name = "evidence_url", nullable = false, length = 500, updatable = false)
    private String evidenceUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "evidence_type", nullable = false, length = 20, updatable = false)
    private EvidenceType evidenceType;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    // Assigned by the database (identity column)
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static ProofEntity fromDomain(Proof proof) {
        return new ProofEntity(
            proof.getId(),
            proof.getWagerId(),
            proof.getSubmitterId(),
            proof.getClaimedWinnerId(),
            proof.getEvidenceUrl(),
            proof.getEvidenceType(),
            proof.getSubmittedAt(),
            null
        );
    }

    public Proof toDomain() {
        return new Proof(id, wagerId, submitterId, claimedWinnerId, evidenceUrl, evidenceType,
                submittedAt, sequenceNumber);
    }
}
