package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.Wager;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class WagerAcceptedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    UUID creatorId;
    UUID acceptorId;
    long stakeAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerAccepted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerAcceptedEvent fromWager(Wager wager) {
        return new WagerAcceptedEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getCreatorId(),
            wager.getAcceptorId(),
            wager.getStakeAmount(),
            wager.getAcceptedAt()
        );
    }
}
