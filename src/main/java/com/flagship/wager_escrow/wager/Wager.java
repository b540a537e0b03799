package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.exception.StateConflictException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Wager domain object.
 *
 * Immutable: every transition returns a new instance and validates the edge
 * against {@link WagerStatus#canTransitionTo}. Nullable fields follow the state:
 * <ul>
 *   <li>acceptorId and acceptedAt are set from ACCEPTED on</li>
 *   <li>resultSubmittedAt is set from PENDING_RESULT on</li>
 *   <li>winner, payout, fee and outcome are set only once COMPLETED</li>
 * </ul>
 * The wager never references its acceptance, proofs or dispute; those
 * records point at the wager by id.
 */
@Value
@Builder(toBuilder = true)
public class Wager {
    UUID id;
    String title;
    String description;
    String game;
    UUID creatorId;
    UUID acceptorId;
    UUID targetUserId;
    UUID winnerId;
    long stakeAmount;
    Long payoutAmount;
    Long platformFee;
    SettlementOutcome settlementOutcome;
    WagerStatus status;
    Instant createdAt;
    Instant acceptedAt;
    Instant startedAt;
    Instant resultSubmittedAt;
    Instant completedAt;
    Instant expiresAt;

    /**
     * Creates a new wager in OPEN status whose acceptance window starts now.
     */
    public static Wager open(UUID id, UUID creatorId, long stakeAmount, String game,
                             UUID targetUserId, String title, String description,
                             Instant now, Duration acceptanceWindow) {
        return Wager.builder()
                .id(id)
                .title(title)
                .description(description)
                .game(game)
                .creatorId(creatorId)
                .targetUserId(targetUserId)
                .stakeAmount(stakeAmount)
                .status(WagerStatus.OPEN)
                .createdAt(now)
                .expiresAt(now.plus(acceptanceWindow))
                .build();
    }

    public boolean isParticipant(UUID userId) {
        return userId != null && (userId.equals(creatorId) || userId.equals(acceptorId));
    }

    /**
     * Returns the other participant, or null if {@code userId} is not a participant.
     */
    public UUID counterpartyOf(UUID userId) {
        if (userId == null) {
            return null;
        }
        if (userId.equals(creatorId)) {
            return acceptorId;
        }
        if (userId.equals(acceptorId)) {
            return creatorId;
        }
        return null;
    }

    /**
     * An OPEN wager is stale strictly after its deadline: {@code now > expiresAt}.
     */
    public boolean isExpiredAt(Instant now) {
        return status == WagerStatus.OPEN && now.isAfter(expiresAt);
    }

    public Instant disputeDeadline(Duration disputeWindow) {
        return resultSubmittedAt == null ? null : resultSubmittedAt.plus(disputeWindow);
    }

    /**
     * The result window is open while {@code now <= resultSubmittedAt + window}.
     */
    public boolean isResultWindowOpenAt(Instant now, Duration disputeWindow) {
        Instant deadline = disputeDeadline(disputeWindow);
        return status == WagerStatus.PENDING_RESULT && deadline != null && !now.isAfter(deadline);
    }

    /**
     * PENDING_RESULT with a deadline strictly in the past.
     */
    public boolean hasLapsedResultWindowAt(Instant now, Duration disputeWindow) {
        Instant deadline = disputeDeadline(disputeWindow);
        return status == WagerStatus.PENDING_RESULT && deadline != null && now.isAfter(deadline);
    }

    public Wager accept(UUID acceptor, Instant now) {
        requireTransition(WagerStatus.ACCEPTED);
        return toBuilder()
                .acceptorId(acceptor)
                .acceptedAt(now)
                .status(WagerStatus.ACCEPTED)
                .build();
    }

    public Wager start(Instant now) {
        requireTransition(WagerStatus.IN_PROGRESS);
        return toBuilder()
                .startedAt(now)
                .status(WagerStatus.IN_PROGRESS)
                .build();
    }

    /**
     * First proof arrived: opens the dispute window at {@code now}.
     */
    public Wager markResultSubmitted(Instant now) {
        requireTransition(WagerStatus.PENDING_RESULT);
        return toBuilder()
                .resultSubmittedAt(now)
                .status(WagerStatus.PENDING_RESULT)
                .build();
    }

    public Wager dispute() {
        requireTransition(WagerStatus.DISPUTED);
        return toBuilder()
                .status(WagerStatus.DISPUTED)
                .build();
    }

    public Wager completeWithWinner(UUID winner, long payout, long fee, Instant now) {
        requireTransition(WagerStatus.COMPLETED);
        if (!isParticipant(winner)) {
            throw new IllegalArgumentException("Winner " + winner + " is not a participant of wager " + id);
        }
        if (payout + fee != stakeAmount) {
            throw new IllegalArgumentException(
                    String.format("Payout %d and fee %d do not add up to stake %d", payout, fee, stakeAmount));
        }
        return toBuilder()
                .winnerId(winner)
                .payoutAmount(payout)
                .platformFee(fee)
                .settlementOutcome(SettlementOutcome.WINNER_PAID)
                .completedAt(now)
                .status(WagerStatus.COMPLETED)
                .build();
    }

    /**
     * Void resolution: no winner, the whole stake goes back to the creator.
     */
    public Wager completeVoid(Instant now) {
        requireTransition(WagerStatus.COMPLETED);
        return toBuilder()
                .winnerId(null)
                .payoutAmount(stakeAmount)
                .platformFee(0L)
                .settlementOutcome(SettlementOutcome.VOID_REFUNDED)
                .completedAt(now)
                .status(WagerStatus.COMPLETED)
                .build();
    }

    public Wager cancel(Instant now) {
        requireTransition(WagerStatus.CANCELLED);
        return toBuilder()
                .completedAt(now)
                .status(WagerStatus.CANCELLED)
                .build();
    }

    public Wager expire(Instant now) {
        requireTransition(WagerStatus.EXPIRED);
        return toBuilder()
                .completedAt(now)
                .status(WagerStatus.EXPIRED)
                .build();
    }

    private void requireTransition(WagerStatus target) {
        if (!status.canTransitionTo(target)) {
            throw StateConflictException.illegalTransition(status, target);
        }
    }
}
