package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.Dispute;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class DisputeOpenedEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    UUID disputeId;
    UUID disputerId;
    UUID contestedWinnerId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DisputeOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DisputeOpenedEvent fromDispute(Dispute dispute, UUID contestedWinnerId) {
        return new DisputeOpenedEvent(
            UUID.randomUUID(),
            dispute.getWagerId(),
            dispute.getId(),
            dispute.getDisputerId(),
            contestedWinnerId,
            dispute.getOpenedAt()
        );
    }
}
