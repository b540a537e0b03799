package com.flagship.wager_escrow.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the wagers table.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain(Wager)}
 * - Identity, parties, stake and creation data are updatable = false
 * - Lifecycle timestamps come from the domain object (driven by the injected clock);
 *   only updated_at is maintained by JPA hooks
 */
@Entity
@Table(
    name = "wagers",
    indexes = {
        @Index(name = "idx_wagers_status_expires_at", columnList = "status, expires_at"),
        @Index(name = "idx_wagers_status_result_submitted_at", columnList = "status, result_submitted_at"),
        @Index(name = "idx_wagers_creator_id", columnList = "creator_id"),
        @Index(name = "idx_wagers_acceptor_id", columnList = "acceptor_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WagerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(length = 200, updatable = false)
    private String title;

    @Column(length = 2000, updatable = false)
    private String description;

    @Column(nullable = false, length = 100, updatable = false)
    private String game;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Column(name = "acceptor_id")
    private UUID acceptorId;

    @Column(name = "target_user_id", updatable = false)
    private UUID targetUserId;

    @Column(name = "winner_id")
    private UUID winnerId;

    @Column(name = "stake_amount", nullable = false, updatable = false)
    private long stakeAmount;

    @Column(name = "payout_amount")
    private Long payoutAmount;

    @Column(name = "platform_fee")
    private Long platformFee;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_outcome", length = 20)
    private SettlementOutcome settlementOutcome;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WagerStatus status;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "result_submitted_at")
    private Instant resultSubmittedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create a WagerEntity.
     *
     * @param wager domain wager in OPEN status
     * @param idempotencyKey key of the creating request, may be null
     */
    static WagerEntity fromDomain(Wager wager, String idempotencyKey) {
        return new WagerEntity(
            wager.getId(),
            wager.getTitle(),
            wager.getDescription(),
            wager.getGame(),
            wager.getCreatorId(),
            wager.getAcceptorId(),
            wager.getTargetUserId(),
            wager.getWinnerId(),
            wager.getStakeAmount(),
            wager.getPayoutAmount(),
            wager.getPlatformFee(),
            wager.getSettlementOutcome(),
            wager.getStatus(),
            idempotencyKey,
            wager.getCreatedAt(),
            wager.getAcceptedAt(),
            wager.getStartedAt(),
            wager.getResultSubmittedAt(),
            wager.getCompletedAt(),
            wager.getExpiresAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    public Wager toDomain() {
        return Wager.builder()
            .id(id)
            .title(title)
            .description(description)
            .game(game)
            .creatorId(creatorId)
            .acceptorId(acceptorId)
            .targetUserId(targetUserId)
            .winnerId(winnerId)
            .stakeAmount(stakeAmount)
            .payoutAmount(payoutAmount)
            .platformFee(platformFee)
            .settlementOutcome(settlementOutcome)
            .status(status)
            .createdAt(createdAt)
            .acceptedAt(acceptedAt)
            .startedAt(startedAt)
            .resultSubmittedAt(resultSubmittedAt)
            .completedAt(completedAt)
            .expiresAt(expiresAt)
            .build();
    }

    /**
     * Copies the mutable lifecycle fields from a transitioned domain object.
     * Identity, parties, stake, idempotency key and creation data never change.
     */
    void updateFromDomain(Wager wager) {
        if (!id.equals(wager.getId())) {
            throw new IllegalArgumentException("Cannot update wager " + id + " from " + wager.getId());
        }
        this.acceptorId = wager.getAcceptorId();
        this.winnerId = wager.getWinnerId();
        this.payoutAmount = wager.getPayoutAmount();
        this.platformFee = wager.getPlatformFee();
        this.settlementOutcome = wager.getSettlementOutcome();
        this.status = wager.getStatus();
        this.acceptedAt = wager.getAcceptedAt();
        this.startedAt = wager.getStartedAt();
        this.resultSubmittedAt = wager.getResultSubmittedAt();
        this.completedAt = wager.getCompletedAt();
    }
}
