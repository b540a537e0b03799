package com.flagship.wager_escrow.escrow;

import com.flagship.wager_escrow.wager.exception.EscrowHoldFailedException;
import com.flagship.wager_escrow.wager.exception.EscrowUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The only component that moves wager money.
 *
 * Each operation is idempotent per (wager id, kind): the first call goes to the
 * wallet and is journaled in escrow_operations, later calls return the journal
 * entry without calling the wallet again.
 *
 * All operations use MANDATORY propagation. They join the state machine's
 * transaction so a ledger effect and the wager state write commit or roll
 * back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowLedger {

    private final WalletClient walletClient;
    private final EscrowOperationRepository operationRepository;
    private final Clock clock;

    /**
     * Locks the creator's stake.
     *
     * @throws EscrowHoldFailedException if the creator cannot cover the stake
     * @throws EscrowUnavailableException if the wallet fails otherwise
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EscrowOperation hold(UUID wagerId, UUID userId, long amount) {
        return apply(wagerId, EscrowOperationKind.HOLD, userId, null, amount,
                key -> walletClient.hold(userId, amount, key));
    }

    /**
     * Pays the winner out of the creator's escrow.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EscrowOperation release(UUID wagerId, UUID fromUserId, UUID toUserId, long amount) {
        return apply(wagerId, EscrowOperationKind.RELEASE, fromUserId, toUserId, amount,
                key -> walletClient.release(fromUserId, toUserId, amount, key));
    }

    /**
     * Moves the platform fee out of the creator's escrow.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EscrowOperation collect(UUID wagerId, UUID fromUserId, long amount) {
        return apply(wagerId, EscrowOperationKind.COLLECT, fromUserId, null, amount,
                key -> walletClient.collect(fromUserId, amount, key));
    }

    /**
     * Returns the whole escrowed amount to the holder.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EscrowOperation refund(UUID wagerId, UUID userId, long amount) {
        return apply(wagerId, EscrowOperationKind.REFUND, userId, null, amount,
                key -> walletClient.refund(userId, amount, key));
    }

    @Transactional(readOnly = true)
    public List<EscrowOperation> operationsFor(UUID wagerId) {
        return operationRepository.findByWagerIdOrderByCreatedAtAsc(wagerId).stream()
                .map(EscrowOperationEntity::toDomain)
                .toList();
    }

    private EscrowOperation apply(UUID wagerId, EscrowOperationKind kind, UUID fromUserId, UUID toUserId,
                                  long amount, WalletCall call) {
        var existing = operationRepository.findByWagerIdAndKind(wagerId, kind);
        if (existing.isPresent()) {
            log.info("Escrow {} already applied for wager {}, walletRef={}",
                    kind, wagerId, existing.get().getWalletReference());
            return existing.get().toDomain();
        }

        String idempotencyKey = kind.idempotencyKey(wagerId);
        UUID walletReference = callWallet(wagerId, kind, () -> call.invoke(idempotencyKey));

        EscrowOperation operation = new EscrowOperation(
                UUID.randomUUID(),
                wagerId,
                kind,
                fromUserId,
                toUserId,
                amount,
                idempotencyKey,
                walletReference,
                Instant.now(clock)
        );
        operationRepository.save(EscrowOperationEntity.fromDomain(operation));

        log.info("Escrow {} applied for wager {}: amount={}, from={}, to={}, walletRef={}",
                kind, wagerId, amount, fromUserId, toUserId, walletReference);
        return operation;
    }

    private UUID callWallet(UUID wagerId, EscrowOperationKind kind, Supplier<UUID> call) {
        try {
            return call.get();
        } catch (InsufficientFundsException e) {
            log.warn("Escrow {} rejected for wager {}: {}", kind, wagerId, e.getMessage());
            throw new EscrowHoldFailedException(e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Wallet call failed: wager={}, kind={}, error={}", wagerId, kind, e.getMessage());
            throw new EscrowUnavailableException(
                    String.format("Wallet %s failed for wager %s", kind.name().toLowerCase(), wagerId), e);
        }
    }

    @FunctionalInterface
    private interface WalletCall {
        UUID invoke(String idempotencyKey);
    }
}
