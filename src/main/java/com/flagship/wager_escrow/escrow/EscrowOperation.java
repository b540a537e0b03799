package com.flagship.wager_escrow.escrow;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Journal record of a money movement that has been applied for a wager.
 * toUserId is null for HOLD, REFUND and COLLECT.
 */
@Value
public class EscrowOperation {
    UUID id;
    UUID wagerId;
    EscrowOperationKind kind;
    UUID fromUserId;
    UUID toUserId;
    long amount;
    String idempotencyKey;
    UUID walletReference;
    Instant createdAt;
}
