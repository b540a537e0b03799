package com.flagship.wager_escrow.wager.exception;

import lombok.Getter;

/**
 * Root of every failure the wager engine reports to its callers.
 *
 * Each subclass carries a machine-readable reason code that the HTTP layer
 * passes through unchanged, so clients can branch without parsing messages.
 */
@Getter
public abstract class WagerException extends RuntimeException {

    private final String reason;

    protected WagerException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected WagerException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Whether the same request may succeed if simply retried later.
     */
    public boolean isRetryable() {
        return false;
    }
}
