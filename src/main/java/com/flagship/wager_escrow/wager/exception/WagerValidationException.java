package com.flagship.wager_escrow.wager.exception;

/**
 * Input rejected before any side effect: stake out of bounds, self-challenge,
 * malformed proof, rate limits.
 */
public class WagerValidationException extends WagerException {

    public static final String INVALID_STAKE = "INVALID_STAKE";
    public static final String IDEMPOTENCY_KEY_CONFLICT = "IDEMPOTENCY_KEY_CONFLICT";
    public static final String SELF_CHALLENGE = "SELF_CHALLENGE";
    public static final String NOT_TARGET_USER = "NOT_TARGET_USER";
    public static final String MALFORMED_PROOF = "MALFORMED_PROOF";
    public static final String REASON_TOO_SHORT = "REASON_TOO_SHORT";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String TOO_MANY_ACTIVE = "TOO_MANY_ACTIVE";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    public WagerValidationException(String reason, String message) {
        super(reason, message);
    }
}
