package com.flagship.wager_escrow.wager;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AcceptanceRepository extends JpaRepository<AcceptanceEntity, UUID> {
}
