package com.flagship.wager_escrow.wager.exception;

import com.flagship.wager_escrow.wager.WagerStatus;
import lombok.Getter;

/**
 * The operation is not legal in the wager's current state.
 *
 * The current state travels with the exception so the caller can resync
 * instead of guessing what happened.
 */
@Getter
public class StateConflictException extends WagerException {

    public static final String ILLEGAL_TRANSITION = "ILLEGAL_TRANSITION";
    public static final String ALREADY_ACCEPTED = "ALREADY_ACCEPTED";
    public static final String PROOF_ALREADY_SUBMITTED = "PROOF_ALREADY_SUBMITTED";
    public static final String DISPUTE_ALREADY_RESOLVED = "DISPUTE_ALREADY_RESOLVED";
    public static final String DEADLINE_NOT_REACHED = "DEADLINE_NOT_REACHED";

    private final WagerStatus currentState;

    public StateConflictException(String reason, WagerStatus currentState, String message) {
        super(reason, message);
        this.currentState = currentState;
    }

    public static StateConflictException illegalTransition(WagerStatus from, WagerStatus to) {
        return new StateConflictException(ILLEGAL_TRANSITION, from,
                String.format("Cannot move wager from %s to %s", from, to));
    }
}
