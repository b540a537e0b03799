package com.flagship.wager_escrow.wager.event;

import com.flagship.wager_escrow.wager.SettlementOutcome;
import com.flagship.wager_escrow.wager.SettlementTrigger;
import com.flagship.wager_escrow.wager.Wager;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Escrow has been paid out or void-refunded. {@code winnerId} is null for a void.
 */
@Value
public class WagerSettledEvent implements WagerEvent {
    UUID eventId;
    UUID wagerId;
    SettlementOutcome outcome;
    SettlementTrigger trigger;
    UUID winnerId;
    long payoutAmount;
    long platformFee;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WagerSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WagerSettledEvent fromWager(Wager wager, SettlementTrigger trigger) {
        return new WagerSettledEvent(
            UUID.randomUUID(),
            wager.getId(),
            wager.getSettlementOutcome(),
            trigger,
            wager.getWinnerId(),
            wager.getPayoutAmount(),
            wager.getPlatformFee(),
            wager.getCompletedAt()
        );
    }
}
