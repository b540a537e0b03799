package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.Wager;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A wager was opened and the creator's stake is held in escrow.
 */
@Value
public class WagerCreatedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    UUID creatorId;
    UUID targetUserId;
    String game;
    long stakeAmount;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerCreatedEvent fromWager(Wager wager) {
        return new WagerCreatedEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getCreatorId(),
            wager.getTargetUserId(),
            wager.getGame(),
            wager.getStakeAmount(),
            wager.getExpiresAt(),
            wager.getCreatedAt()
        );
    }
}
