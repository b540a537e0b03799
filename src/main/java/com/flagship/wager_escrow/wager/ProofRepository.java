package com.flagship.wager_escrow.wager;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProofRepository extends JpaRepository<ProofEntity, UUID> {

    /**
     * Submission order. submittedAt can tie when two proofs land in the same
     * instant, the sequence number cannot.
     */
    List<ProofEntity> findByWagerIdOrderBySubmittedAtAscSequenceNumberAsc(UUID wagerId);
}
