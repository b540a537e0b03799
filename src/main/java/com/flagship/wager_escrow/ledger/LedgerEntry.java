package com.flagship.wager_escrow.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * One immutable line of a ledger transaction. Amounts are positive minor units.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    long amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
