package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.config.WagerProperties;
import com.flagship.wager_escrow.observability.CorrelationContext;
import com.flagship.wager_escrow.wager.exception.WagerNotFoundException;
import com.flagship.wager_escrow.wager.exception.WagerValidationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Front door for disputes: opening, moderator assignment and resolution.
 *
 * Outcomes are only ever applied through {@link WagerStateMachine#resolveDispute}.
 * Auto-assignment walks the configured moderator pool round-robin.
 */
@Service
@Slf4j
public class DisputeArbitrationService {

    private final WagerStateMachine stateMachine;
    private final WagerStore store;
    private final WagerProperties properties;
    private final TransactionOperations transactions;
    private final Clock clock;
    private final AtomicInteger nextModerator = new AtomicInteger();

    public DisputeArbitrationService(WagerStateMachine stateMachine, WagerStore store,
                                     WagerProperties properties, TransactionOperations transactions,
                                     Clock clock) {
        this.stateMachine = stateMachine;
        this.store = store;
        this.properties = properties;
        this.transactions = transactions;
        this.clock = clock;
    }

    /**
     * Opens the dispute, then assigns a moderator from the pool if one is configured.
     *
     * The two steps commit separately. A failed assignment leaves an open,
     * unassigned dispute that can still be assigned by hand.
     */
    public Dispute openDispute(UUID wagerId, UUID disputerId, String reason) {
        Dispute dispute = stateMachine.openDispute(wagerId, disputerId, reason);
        Optional<UUID> moderator = pickModerator();
        if (moderator.isEmpty()) {
            return dispute;
        }
        try {
            return assign(dispute.getId(), moderator.get());
        } catch (RuntimeException e) {
            log.error("Auto-assignment of dispute {} to {} failed, left unassigned: {}",
                    dispute.getId(), moderator.get(), e.getMessage());
            return dispute;
        }
    }

    /**
     * Assigns (or reassigns) an unresolved dispute. Without an explicit
     * moderator the next one from the pool is used.
     *
     * @throws WagerValidationException if no moderator is given and the pool is empty
     */
    public Dispute assignModerator(UUID disputeId, UUID moderatorId) {
        UUID assignee = moderatorId != null
                ? moderatorId
                : pickModerator().orElseThrow(() -> new WagerValidationException(
                        WagerValidationException.INVALID_REQUEST,
                        "No moderator given and no moderator pool configured"));
        return assign(disputeId, assignee);
    }

    public Dispute resolveDispute(UUID disputeId, UUID moderatorId, DisputeResolution outcome, String notes) {
        return stateMachine.resolveDispute(disputeId, moderatorId, outcome, notes);
    }

    @Transactional(readOnly = true)
    public Dispute getDispute(UUID disputeId) {
        return store.findDispute(disputeId).orElseThrow(() -> WagerNotFoundException.dispute(disputeId));
    }

    @Transactional(readOnly = true)
    public Optional<Dispute> findDisputeForWager(UUID wagerId) {
        return store.findDisputeByWagerId(wagerId);
    }

    /**
     * Runs in its own transaction under the wager lock, so it cannot interleave
     * with a resolution of the same dispute.
     */
    private Dispute assign(UUID disputeId, UUID moderatorId) {
        UUID wagerId = getDispute(disputeId).getWagerId();
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, wagerId.toString());
        try {
            return transactions.execute(status -> {
                Wager wager = store.lockById(wagerId);
                Dispute dispute = store.findDispute(disputeId)
                        .orElseThrow(() -> WagerNotFoundException.dispute(disputeId));

                Dispute assigned = store.updateDispute(
                        dispute.assignTo(moderatorId, Instant.now(clock), wager.getStatus()));
                log.info("Dispute {} assigned to moderator {}", disputeId, moderatorId);
                return assigned;
            });
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }

    Optional<UUID> pickModerator() {
        List<UUID> pool = properties.getDispute().getModerators();
        if (pool == null || pool.isEmpty()) {
            return Optional.empty();
        }
        int index = Math.floorMod(nextModerator.getAndIncrement(), pool.size());
        return Optional.of(pool.get(index));
    }
}
