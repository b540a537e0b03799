package com.flagship.wager_escrow.wager.exception;

/**
 * Money could not be moved. Aborts the whole operation, including the state write.
 */
public abstract class EscrowException extends WagerException {

    protected EscrowException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
