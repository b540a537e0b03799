package com.flagship.wager_escrow.wager.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a wager, published on the wager-events topic keyed by wager id.
 *
 * Consumers deduplicate on {@link #getEventId()}.
 */
public interface WagerEvent {

    UUID getEventId();

    UUID getWagerId();

    Instant getOccurredAt();

    String getEventType();
}
