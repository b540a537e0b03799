package com.flagship.wager_escrow.wager;

/**
 * What caused a wager to settle.
 */
public enum SettlementTrigger {

    /**
     * Both participants claimed the same winner.
     */
    AGREED_PROOFS,

    /**
     * The dispute window lapsed; the first claim stands.
     */
    LAPSED_WINDOW,

    /**
     * A moderator resolved the dispute.
     */
    DISPUTE_RESOLUTION
}
