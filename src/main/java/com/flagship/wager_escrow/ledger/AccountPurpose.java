package com.flagship.wager_escrow.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What a ledger account is for. User accounts come in pairs (AVAILABLE and
 * ESCROW); PLATFORM_FEE and FUNDING are singletons owned by the platform.
 */
@Getter
@RequiredArgsConstructor
public enum AccountPurpose {

    /**
     * Spendable user balance. The platform owes it to the user.
     */
    AVAILABLE(Account.AccountType.LIABILITY, "AVL"),

    /**
     * User funds earmarked for open wagers.
     */
    ESCROW(Account.AccountType.LIABILITY, "ESC"),

    /**
     * Fees the platform has earned from settled wagers.
     */
    PLATFORM_FEE(Account.AccountType.EQUITY, "PLATFORM-FEE"),

    /**
     * Counterpart of user deposits (cash held by the platform).
     */
    FUNDING(Account.AccountType.ASSET, "FUNDING");

    private final Account.AccountType accountType;
    private final String numberPrefix;

    public boolean isUserAccount() {
        return this == AVAILABLE || this == ESCROW;
    }
}
