package com.flagship.wager_escrow.wager.exception;

import java.util.UUID;

public class WagerNotFoundException extends WagerException {

    public static final String WAGER_NOT_FOUND = "WAGER_NOT_FOUND";
    public static final String DISPUTE_NOT_FOUND = "DISPUTE_NOT_FOUND";

    private WagerNotFoundException(String reason, String message) {
        super(reason, message);
    }

    public static WagerNotFoundException wager(UUID wagerId) {
        return new WagerNotFoundException(WAGER_NOT_FOUND, "Wager not found: " + wagerId);
    }

    public static WagerNotFoundException dispute(UUID disputeId) {
        return new WagerNotFoundException(DISPUTE_NOT_FOUND, "Dispute not found: " + disputeId);
    }
}
