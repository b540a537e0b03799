package com.flagship.wager_escrow.escrow;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised by a {@link WalletClient} when a hold exceeds the available balance.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID userId;
    private final long available;
    private final long requested;

    public InsufficientFundsException(UUID userId, long available, long requested) {
        super(String.format("Insufficient funds for user %s: %d available, %d requested", userId, available, requested));
        this.userId = userId;
        this.available = available;
        this.requested = requested;
    }
}
