package com.flagship.wager_escrow.wager.exception;

import com.flagship.wager_escrow.wager.WagerStatus;

import java.util.UUID;

/**
 * The result window after the first proof has lapsed; the first claim stands.
 */
public class DisputeWindowClosedException extends DeadlinePassedException {

    public static final String DISPUTE_WINDOW_CLOSED = "DISPUTE_WINDOW_CLOSED";

    public DisputeWindowClosedException(UUID wagerId, WagerStatus currentState) {
        super(DISPUTE_WINDOW_CLOSED, currentState,
                "Dispute window for wager " + wagerId + " has closed");
    }
}
