package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.Wager;
import com.flagship.wager_escrow.wager.WagerStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An OPEN wager ended without a match (CANCELLED or EXPIRED) and the stake went back to the creator.
 */
@Value
public class WagerClosedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    UUID creatorId;
    WagerStatus closedAs;
    long refundedAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerClosedEvent fromWager(Wager wager) {
        return new WagerClosedEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getCreatorId(),
            wager.getStatus(),
            wager.getStakeAmount(),
            wager.getCompletedAt()
        );
    }
}
