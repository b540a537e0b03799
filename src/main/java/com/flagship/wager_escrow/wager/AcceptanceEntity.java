package com.flagship.wager_escrow.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Keyed by wager id: the primary key is what makes acceptance 1:1.
 * All columns are insert-only.
 */
@Entity
@Table(name = "wager_acceptances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AcceptanceEntity {

    @Id
    @Column(name = "wager_id", nullable = false, updatable = false)
    private UUID wagerId;

    @Column(name = "acceptor_id", nullable = false, updatable = false)
    private UUID acceptorId;

    @Column(name = "accepted_at", nullable = false, updatable = false)
    private Instant acceptedAt;

    static AcceptanceEntity fromDomain(Acceptance acceptance) {
        return new AcceptanceEntity(acceptance.getWagerId(), acceptance.getAcceptorId(), acceptance.getAcceptedAt());
    }

    public Acceptance toDomain() {
        return new Acceptance(wagerId, acceptorId, acceptedAt);
    }
}
