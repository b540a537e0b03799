package com.flagship.wager_escrow.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for wager_disputes. wager_id is unique (one dispute per wager).
 */
@Entity
@Table(name = "wager_disputes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DisputeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wager_id", nullable = false, unique = true, updatable = false)
    private UUID wagerId;

    @Column(name = "disputer_id", nullable = false, updatable = false)
    private UUID disputerId;

    @Column(nullable = false, length = 2000, updatable = false)
    private String reason;

    @Column(name = "assigned_moderator_id")
    private UUID assignedModeratorId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private DisputeResolution resolution;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "moderator_notes", length = 2000)
    private String moderatorNotes;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    static DisputeEntity fromDomain(Dispute dispute) {
        return new DisputeEntity(
            dispute.getId(),
            dispute.getWagerId(),
            dispute.getDisputerId(),
            dispute.getReason(),
            dispute.getAssignedModeratorId(),
            dispute.getAssignedAt(),
            dispute.getResolution(),
            dispute.getResolvedBy(),
            dispute.getModeratorNotes(),
            dispute.getOpenedAt(),
            dispute.getResolvedAt()
        );
    }

    public Dispute toDomain() {
        return new Dispute(id, wagerId, disputerId, reason, assignedModeratorId, assignedAt,
                resolution, resolvedBy, moderatorNotes, openedAt, resolvedAt);
    }

    /**
     * Only assignment and resolution fields are mutable, and only until resolved.
     */
    void updateFromDomain(Dispute dispute) {
        if (this.resolution != null) {
            throw new IllegalStateException("Dispute " + id + " is resolved and can no longer change");
        }
        this.assignedModeratorId = dispute.getAssignedModeratorId();
        this.assignedAt = dispute.getAssignedAt();
        this.resolution = dispute.getResolution();
        this.resolvedBy = dispute.getResolvedBy();
        this.moderatorNotes = dispute.getModeratorNotes();
        this.resolvedAt = dispute.getResolvedAt();
    }
}
