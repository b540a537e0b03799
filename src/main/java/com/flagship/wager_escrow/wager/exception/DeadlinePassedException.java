package com.flagship.wager_escrow.wager.exception;

import com.flagship.wager_escrow.wager.WagerStatus;

/**
 * A wall-clock deadline had already passed when the request arrived.
 *
 * Thrown after the timeout transition has been applied lazily, so the
 * transaction that raised it must still commit. State-machine operations
 * declare {@code noRollbackFor} this type.
 */
public abstract class DeadlinePassedException extends StateConflictException {

    protected DeadlinePassedException(String reason, WagerStatus currentState, String message) {
        super(reason, currentState, message);
    }
}
