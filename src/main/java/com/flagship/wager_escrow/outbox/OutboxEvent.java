package com.flagship.wager_escrow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A wager event waiting in the outbox for relay to Kafka.
 *
 * Written in the same transaction as the wager change it describes, so an
 * event exists exactly when its state change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType,
                payload, now, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
