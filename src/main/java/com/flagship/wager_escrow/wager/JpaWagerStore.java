package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.exception.WagerNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JPA-backed {@link WagerStore}.
 *
 * Bridges the domain objects and their entities. Writes and locks require an
 * active transaction owned by the caller; reads open a read-only one if needed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaWagerStore implements WagerStore {

    private static final Set<WagerStatus> OPEN_ACCEPTANCE_STATUSES = EnumSet.of(
            WagerStatus.ACCEPTED, WagerStatus.IN_PROGRESS, WagerStatus.PENDING_RESULT);

    private final WagerRepository wagerRepository;
    private final AcceptanceRepository acceptanceRepository;
    private final ProofRepository proofRepository;
    private final DisputeRepository disputeRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wager insert(Wager wager, String idempotencyKey) {
        WagerEntity saved = wagerRepository.save(WagerEntity.fromDomain(wager, idempotencyKey));
        log.debug("Inserted wager {} (idempotencyKey={})", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wager> findById(UUID wagerId) {
        return wagerRepository.findById(wagerId).map(WagerEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wager> findByIdempotencyKey(String idempotencyKey) {
        return wagerRepository.findByIdempotencyKey(idempotencyKey).map(WagerEntity::toDomain);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wager lockById(UUID wagerId) {
        return wagerRepository.findByIdForUpdate(wagerId)
                .map(WagerEntity::toDomain)
                .orElseThrow(() -> WagerNotFoundException.wager(wagerId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wager update(Wager wager) {
        WagerEntity existing = wagerRepository.findById(wager.getId())
                .orElseThrow(() -> WagerNotFoundException.wager(wager.getId()));
        existing.updateFromDomain(wager);
        WagerEntity updated = wagerRepository.save(existing);
        log.debug("Updated wager {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Acceptance> findAcceptance(UUID wagerId) {
        return acceptanceRepository.findById(wagerId).map(AcceptanceEntity::toDomain);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Acceptance insertAcceptance(Acceptance acceptance) {
        if (acceptanceRepository.existsById(acceptance.getWagerId())) {
            throw new IllegalStateException("Wager " + acceptance.getWagerId() + " already has an acceptance");
        }
        return acceptanceRepository.save(AcceptanceEntity.fromDomain(acceptance)).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Proof> findProofs(UUID wagerId) {
        return proofRepository.findByWagerIdOrderBySubmittedAtAscSequenceNumberAsc(wagerId).stream()
                .map(ProofEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Proof appendProof(Proof proof) {
        return proofRepository.saveAndFlush(ProofEntity.fromDomain(proof)).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Dispute> findDispute(UUID disputeId) {
        return disputeRepository.findById(disputeId).map(DisputeEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Dispute> findDisputeByWagerId(UUID wagerId) {
        return disputeRepository.findByWagerId(wagerId).map(DisputeEntity::toDomain);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Dispute insertDispute(Dispute dispute) {
        return disputeRepository.save(DisputeEntity.fromDomain(dispute)).toDomain();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Dispute updateDispute(Dispute dispute) {
        DisputeEntity existing = disputeRepository.findById(dispute.getId())
                .orElseThrow(() -> WagerNotFoundException.dispute(dispute.getId()));
        existing.updateFromDomain(dispute);
        return disputeRepository.save(existing).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findExpiredOpenWagerIds(Instant now, int limit) {
        return wagerRepository.findExpiredOpenIds(now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findLapsedResultWagerIds(Instant cutoff, int limit) {
        return wagerRepository.findLapsedResultIds(cutoff, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Wager> findByParticipant(UUID userId, Set<WagerStatus> statuses) {
        return wagerRepository.findByParticipantAndStatusIn(userId, statuses).stream()
                .map(WagerEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countCreatedSince(UUID creatorId, Instant since) {
        return wagerRepository.countByCreatorIdAndCreatedAtGreaterThanEqual(creatorId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countOpenAcceptances(UUID acceptorId) {
        return wagerRepository.countByAcceptorIdAndStatusIn(acceptorId, OPEN_ACCEPTANCE_STATUSES);
    }

    @Override
    @Transactional(readOnly = true)
    public WagerTotals totalsFor(UUID userId) {
        Long earnings = wagerRepository.sumPayoutsWonBy(userId);
        Long wagered = wagerRepository.sumStakesCreatedBy(userId);
        return new WagerTotals(
                wagerRepository.countByCreatorId(userId),
                wagerRepository.countByAcceptorId(userId),
                wagerRepository.countByWinnerIdAndStatus(userId, WagerStatus.COMPLETED),
                wagerRepository.countDecidedForParticipant(userId),
                earnings != null ? earnings : 0L,
                wagered != null ? wagered : 0L
        );
    }
}
