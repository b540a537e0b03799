package com.flagship.wager_escrow.ledger;

/**
 * Side of a ledger entry. Every posting carries equal debit and credit totals.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
