package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.exception.StateConflictException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A contested result. One per wager.
 *
 * Only assignment and resolution fields change after opening, and nothing
 * changes once a resolution is recorded.
 */
@Value
public class Dispute {
    UUID id;
    UUID wagerId;
    UUID disputerId;
    String reason;
    UUID assignedModeratorId;
    Instant assignedAt;
    DisputeResolution resolution;
    UUID resolvedBy;
    String moderatorNotes;
    Instant openedAt;
    Instant resolvedAt;

    public static Dispute open(UUID wagerId, UUID disputerId, String reason, Instant now) {
        return new Dispute(UUID.randomUUID(), wagerId, disputerId, reason,
                null, null, null, null, null, now, null);
    }

    public boolean isResolved() {
        return resolution != null;
    }

    public Dispute assignTo(UUID moderatorId, Instant now, WagerStatus wagerStatus) {
        requireUnresolved(wagerStatus);
        return new Dispute(id, wagerId, disputerId, reason, moderatorId, now,
                null, null, null, openedAt, null);
    }

    public Dispute resolve(DisputeResolution outcome, UUID moderatorId, String notes,
                           Instant now, WagerStatus wagerStatus) {
        requireUnresolved(wagerStatus);
        UUID assignee = assignedModeratorId != null ? assignedModeratorId : moderatorId;
        Instant assigned = assignedAt != null ? assignedAt : now;
        return new Dispute(id, wagerId, disputerId, reason, assignee, assigned,
                outcome, moderatorId, notes, openedAt, now);
    }

    private void requireUnresolved(WagerStatus wagerStatus) {
        if (isResolved()) {
            throw new StateConflictException(StateConflictException.DISPUTE_ALREADY_RESOLVED, wagerStatus,
                    String.format("Dispute %s was already resolved as %s", id, resolution));
        }
    }
}
