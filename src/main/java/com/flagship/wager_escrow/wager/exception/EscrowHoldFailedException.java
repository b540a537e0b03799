package com.flagship.wager_escrow.wager.exception;

/**
 * The creator's available balance could not cover the stake.
 */
public class EscrowHoldFailedException extends EscrowException {

    public static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";

    public EscrowHoldFailedException(String message, Throwable cause) {
        super(INSUFFICIENT_FUNDS, message, cause);
    }
}
