package com.flagship.wager_escrow.wager;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WagerRepository extends JpaRepository<WagerEntity, UUID> {

    /**
     * Loads a wager with a row lock (SELECT ... FOR UPDATE).
     * Serializes every mutating operation on one wager.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WagerEntity w WHERE w.id = :id")
    Optional<WagerEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<WagerEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * OPEN wagers strictly past their acceptance deadline.
     */
    @Query("""
        SELECT w.id FROM WagerEntity w
        WHERE w.status = com.flagship.wager_escrow.wager.WagerStatus.OPEN
          AND w.expiresAt < :now
        ORDER BY w.expiresAt ASC
        """)
    List<UUID> findExpiredOpenIds(@Param("now") Instant now, Pageable page);

    /**
     * PENDING_RESULT wagers whose first proof is older than the cutoff and that
     * nobody disputed.
     */
    @Query("""
        SELECT w.id FROM WagerEntity w
        WHERE w.status = com.flagship.wager_escrow.wager.WagerStatus.PENDING_RESULT
          AND w.resultSubmittedAt < :cutoff
          AND NOT EXISTS (SELECT d.id FROM DisputeEntity d WHERE d.wagerId = w.id)
        ORDER BY w.resultSubmittedAt ASC
        """)
    List<UUID> findLapsedResultIds(@Param("cutoff") Instant cutoff, Pageable page);

    @Query("""
        SELECT w FROM WagerEntity w
        WHERE (w.creatorId = :userId OR w.acceptorId = :userId)
          AND w.status IN :statuses
        ORDER BY w.createdAt DESC
        """)
    List<WagerEntity> findByParticipantAndStatusIn(@Param("userId") UUID userId,
                                                   @Param("statuses") Collection<WagerStatus> statuses);

    long countByCreatorIdAndCreatedAtGreaterThanEqual(UUID creatorId, Instant since);

    long countByAcceptorIdAndStatusIn(UUID acceptorId, Collection<WagerStatus> statuses);

    long countByCreatorId(UUID creatorId);

    long countByAcceptorId(UUID acceptorId);

    long countByWinnerIdAndStatus(UUID winnerId, WagerStatus status);

    @Query("""
        SELECT COUNT(w) FROM WagerEntity w
        WHERE (w.creatorId = :userId OR w.acceptorId = :userId)
          AND w.status = com.flagship.wager_escrow.wager.WagerStatus.COMPLETED
          AND w.settlementOutcome = com.flagship.wager_escrow.wager.SettlementOutcome.WINNER_PAID
        """)
    long countDecidedForParticipant(@Param("userId") UUID userId);

    @Query("""
        SELECT COALESCE(SUM(w.payoutAmount), 0) FROM WagerEntity w
        WHERE w.winnerId = :userId
          AND w.status = com.flagship.wager_escrow.wager.WagerStatus.COMPLETED
        """)
    Long sumPayoutsWonBy(@Param("userId") UUID userId);

    @Query("SELECT COALESCE(SUM(w.stakeAmount), 0) FROM WagerEntity w WHERE w.creatorId = :userId")
    Long sumStakesCreatedBy(@Param("userId") UUID userId);
}
