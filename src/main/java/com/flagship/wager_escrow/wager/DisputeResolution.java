package com.flagship.wager_escrow.wager;

/**
 * Moderator decision on a disputed wager.
 */
public enum DisputeResolution {

    /**
     * The first proof's claimed winner is paid.
     */
    CONFIRM_ORIGINAL,

    /**
     * The participant opposite the first proof's claimed winner is paid.
     */
    REVERSE,

    /**
     * Nobody wins; the creator gets the full stake back and no fee is taken.
     */
    VOID
}
