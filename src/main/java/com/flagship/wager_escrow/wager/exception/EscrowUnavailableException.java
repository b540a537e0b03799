package com.flagship.wager_escrow.wager.exception;

/**
 * The wallet service failed for a reason unrelated to the request itself.
 */
public class EscrowUnavailableException extends EscrowException {

    public static final String ESCROW_UNAVAILABLE = "ESCROW_UNAVAILABLE";

    public EscrowUnavailableException(String message, Throwable cause) {
        super(ESCROW_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
