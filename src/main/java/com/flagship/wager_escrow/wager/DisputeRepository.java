package com.flagship.wager_escrow.wager;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<DisputeEntity, UUID> {

    Optional<DisputeEntity> findByWagerId(UUID wagerId);
}
