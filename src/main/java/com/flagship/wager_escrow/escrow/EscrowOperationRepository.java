package com.flagship.wager_escrow.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowOperationRepository extends JpaRepository<EscrowOperationEntity, UUID> {

    Optional<EscrowOperationEntity> findByWagerIdAndKind(UUID wagerId, EscrowOperationKind kind);

    List<EscrowOperationEntity> findByWagerIdOrderByCreatedAtAsc(UUID wagerId);
}
