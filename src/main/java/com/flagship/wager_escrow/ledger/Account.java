package com.flagship.wager_escrow.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A ledger account. Plain value object; rows are read and written through JDBC.
 * ownerId is null for platform accounts.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    AccountType accountType;
    UUID ownerId;
    AccountPurpose purpose;

    /**
     * ASSET balances grow with debits, LIABILITY and EQUITY balances with credits.
     */
    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY
    }
}
