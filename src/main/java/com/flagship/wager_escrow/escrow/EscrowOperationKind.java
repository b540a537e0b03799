package com.flagship.wager_escrow.escrow;

import java.util.UUID;

/**
 * The four money movements a wager can cause. Each happens at most once per wager.
 */
public enum EscrowOperationKind {
    HOLD,
    RELEASE,
    COLLECT,
    REFUND;

    /**
     * Idempotency key sent to the wallet: {@code wager:<id>:<kind>}.
     */
    public String idempotencyKey(UUID wagerId) {
        return "wager:" + wagerId + ":" + name().toLowerCase();
    }
}
