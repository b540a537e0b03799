package com.flagship.wager_escrow.wager;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence boundary for wagers and the records they own.
 *
 * Acceptance, proofs and dispute are stored separately and keyed by wager id.
 * Implementations enforce the uniqueness rules (one acceptance per wager, one
 * proof per participant, one dispute per wager) and must make
 * {@link #lockById(UUID)} block concurrent lockers of the same wager until the
 * surrounding transaction ends.
 */
public interface WagerStore {

    Wager insert(Wager wager, String idempotencyKey);

    Optional<Wager> findById(UUID wagerId);

    Optional<Wager> findByIdempotencyKey(String idempotencyKey);

    /**
     * Loads the wager and locks it for the rest of the current transaction.
     *
     * @throws com.flagship.wager_escrow.wager.exception.WagerNotFoundException if it does not exist
     */
    Wager lockById(UUID wagerId);

    Wager update(Wager wager);

    Optional<Acceptance> findAcceptance(UUID wagerId);

    Acceptance insertAcceptance(Acceptance acceptance);

    /**
     * Proofs in submission order.
     */
    List<Proof> findProofs(UUID wagerId);

    Proof appendProof(Proof proof);

    Optional<Dispute> findDispute(UUID disputeId);

    Optional<Dispute> findDisputeByWagerId(UUID wagerId);

    Dispute insertDispute(Dispute dispute);

    Dispute updateDispute(Dispute dispute);

    List<UUID> findExpiredOpenWagerIds(Instant now, int limit);

    /**
     * Undisputed PENDING_RESULT wagers with {@code resultSubmittedAt < cutoff}.
     */
    List<UUID> findLapsedResultWagerIds(Instant cutoff, int limit);

    List<Wager> findByParticipant(UUID userId, Set<WagerStatus> statuses);

    long countCreatedSince(UUID creatorId, Instant since);

    /**
     * Accepted wagers of this acceptor that are not yet closed.
     */
    long countOpenAcceptances(UUID acceptorId);

    WagerTotals totalsFor(UUID userId);
}
