package com.flagship.wager_escrow.wager.exception;

import com.flagship.wager_escrow.wager.WagerStatus;

import java.util.UUID;

/**
 * The acceptance window of an OPEN wager has closed.
 */
public class WagerExpiredException extends DeadlinePassedException {

    public static final String WAGER_EXPIRED = "WAGER_EXPIRED";

    public WagerExpiredException(UUID wagerId) {
        super(WAGER_EXPIRED, WagerStatus.EXPIRED,
                "Wager " + wagerId + " expired before it was accepted");
    }
}
