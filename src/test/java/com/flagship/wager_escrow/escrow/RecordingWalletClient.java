package com.flagship.wager_escrow.escrow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory wallet for unit tests. Keeps available and escrow balances per
 * user, honors idempotency keys and records every call that moved money.
 */
public class RecordingWalletClient implements WalletClient {

    private final Map<UUID, Long> available = new HashMap<>();
    private final Map<UUID, Long> escrow = new HashMap<>();
    private final Map<String, UUID> references = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private long platformFees;
    private RuntimeException failure;

    public void fund(UUID userId, long amount) {
        available.merge(userId, amount, Long::sum);
    }

    /**
     * Every following call throws {@code failure} until cleared with null.
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public long availableOf(UUID userId) {
        return available.getOrDefault(userId, 0L);
    }

    public long escrowOf(UUID userId) {
        return escrow.getOrDefault(userId, 0L);
    }

    public long platformFees() {
        return platformFees;
    }

    public List<String> calls() {
        return calls;
    }

    @Override
    public UUID hold(UUID userId, long amount, String idempotencyKey) {
        return apply("hold", idempotencyKey, () -> {
            long balance = availableOf(userId);
            if (balance < amount) {
                throw new InsufficientFundsException(userId, balance, amount);
            }
            available.put(userId, balance - amount);
            escrow.merge(userId, amount, Long::sum);
        });
    }

    @Override
    public UUID release(UUID fromUserId, UUID toUserId, long amount, String idempotencyKey) {
        return apply("release", idempotencyKey, () -> {
            debitEscrow(fromUserId, amount);
            available.merge(toUserId, amount, Long::sum);
        });
    }

    @Override
    public UUID collect(UUID fromUserId, long amount, String idempotencyKey) {
        return apply("collect", idempotencyKey, () -> {
            debitEscrow(fromUserId, amount);
            platformFees += amount;
        });
    }

    @Override
    public UUID refund(UUID userId, long amount, String idempotencyKey) {
        return apply("refund", idempotencyKey, () -> {
            debitEscrow(userId, amount);
            available.merge(userId, amount, Long::sum);
        });
    }

    private UUID apply(String kind, String idempotencyKey, Runnable movement) {
        if (failure != null) {
            throw failure;
        }
        UUID existing = references.get(idempotencyKey);
        if (existing != null) {
            return existing;
        }
        movement.run();
        UUID reference = UUID.randomUUID();
        references.put(idempotencyKey, reference);
        calls.add(kind + ":" + idempotencyKey);
        return reference;
    }

    private void debitEscrow(UUID userId, long amount) {
        long held = escrowOf(userId);
        if (held < amount) {
            throw new IllegalStateException("Escrow of " + userId + " is " + held + ", cannot move " + amount);
        }
        escrow.put(userId, held - amount);
    }
}
