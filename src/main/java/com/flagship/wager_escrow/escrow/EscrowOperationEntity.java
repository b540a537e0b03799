package com.flagship.wager_escrow.escrow;

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
 * Insert-only. The unique (wager_id, kind) constraint is the database-level
 * guard against moving a wager's money twice.
 */
@Entity
@Table(
    name = "escrow_operations",
    uniqueConstraints = @UniqueConstraint(name = "uq_escrow_operations_wager_kind", columnNames = {"wager_id", "kind"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowOperationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wager_id", nullable = false, updatable = false)
    private UUID wagerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10, updatable = false)
    private EscrowOperationKind kind;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", updatable = false)
    private UUID toUserId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "wallet_reference", nullable = false, updatable = false)
    private UUID walletReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static EscrowOperationEntity fromDomain(EscrowOperation operation) {
        return new EscrowOperationEntity(
            operation.getId(),
            operation.getWagerId(),
            operation.getKind(),
            operation.getFromUserId(),
            operation.getToUserId(),
            operation.getAmount(),
            operation.getIdempotencyKey(),
            operation.getWalletReference(),
            operation.getCreatedAt()
        );
    }

    public EscrowOperation toDomain() {
        return new EscrowOperation(id, wagerId, kind, fromUserId, toUserId, amount,
                idempotencyKey, walletReference, createdAt);
    }
}
