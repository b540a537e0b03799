package com.flagship.wager_escrow.wager;

import lombok.Value;

/**
 * Result of a create call. {@code replayed} is true when the Idempotency-Key
 * had already produced this wager and nothing new happened.
 */
@Value
public class CreatedWager {
    Wager wager;
    boolean replayed;
}
