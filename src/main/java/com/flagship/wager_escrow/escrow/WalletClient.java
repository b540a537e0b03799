package com.flagship.wager_escrow.escrow;

import java.util.UUID;

/**
 * Boundary to the wallet service that owns user balances.
 *
 * Every call carries an idempotency key; the wallet must treat a repeated key
 * as the original request and return the original reference. Implementations
 * serialize operations per account. Returned UUIDs are wallet-side
 * transaction references.
 */
public interface WalletClient {

    /**
     * Moves {@code amount} from the user's available balance into escrow.
     *
     * @throws InsufficientFundsException if the available balance is below amount
     */
    UUID hold(UUID userId, long amount, String idempotencyKey);

    /**
     * Moves {@code amount} out of {@code fromUserId}'s escrow into {@code toUserId}'s available balance.
     */
    UUID release(UUID fromUserId, UUID toUserId, long amount, String idempotencyKey);

    /**
     * Moves {@code amount} out of {@code fromUserId}'s escrow into the platform fee account.
     */
    UUID collect(UUID fromUserId, long amount, String idempotencyKey);

    /**
     * Returns {@code amount} from the user's escrow to their available balance.
     */
    UUID refund(UUID userId, long amount, String idempotencyKey);
}
