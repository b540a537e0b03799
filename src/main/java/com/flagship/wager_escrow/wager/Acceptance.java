package com.flagship.wager_escrow.wager;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The single user who took the other side of a wager. Written once, never changed.
 */
@Value
public class Acceptance {
    UUID wagerId;
    UUID acceptorId;
    Instant acceptedAt;
}
