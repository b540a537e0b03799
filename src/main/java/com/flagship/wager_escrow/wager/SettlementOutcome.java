package com.flagship.wager_escrow.wager;

/**
 * How a COMPLETED wager's escrow came to rest.
 */
public enum SettlementOutcome {

    /**
     * Winner received the payout, the platform collected the fee.
     */
    WINNER_PAID,

    /**
     * Dispute was voided: full stake returned to the creator, no fee.
     */
    VOID_REFUNDED
}
