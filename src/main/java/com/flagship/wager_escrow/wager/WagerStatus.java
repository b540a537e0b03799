package com.flagship.wager_escrow.wager;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of a wager.
 *
 * <pre>
 *   OPEN ──► ACCEPTED ──► IN_PROGRESS ──► PENDING_RESULT ──► COMPLETED
 *    │                                         │                 ▲
 *    ├──► CANCELLED                            └──► DISPUTED ────┘
 *    └──► EXPIRED
 * </pre>
 *
 * COMPLETED, EXPIRED and CANCELLED are absorbing.
 */
public enum WagerStatus {

    /**
     * Stake is held in escrow, waiting for an acceptor.
     */
    OPEN,

    /**
     * An acceptor has been recorded; the match has not started.
     */
    ACCEPTED,

    /**
     * Match is being played.
     */
    IN_PROGRESS,

    /**
     * At least one proof has been submitted; the dispute window is running.
     */
    PENDING_RESULT,

    /**
     * The non-submitting participant contested the result; waiting for a moderator.
     */
    DISPUTED,

    /**
     * Escrow has been settled (paid out or void-refunded). Terminal.
     */
    COMPLETED,

    /**
     * Nobody accepted before the acceptance window closed. Terminal, stake refunded.
     */
    EXPIRED,

    /**
     * Creator withdrew the wager while it was open. Terminal, stake refunded.
     */
    CANCELLED;

    private static final Map<WagerStatus, Set<WagerStatus>> ALLOWED_TRANSITIONS = Map.of(
            OPEN, EnumSet.of(ACCEPTED, CANCELLED, EXPIRED),
            ACCEPTED, EnumSet.of(IN_PROGRESS),
            IN_PROGRESS, EnumSet.of(PENDING_RESULT),
            PENDING_RESULT, EnumSet.of(DISPUTED, COMPLETED),
            DISPUTED, EnumSet.of(COMPLETED)
    );

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED || this == CANCELLED;
    }

    /**
     * Statuses that count as "active" for a participant (stake still in escrow).
     */
    public static Set<WagerStatus> active() {
        return EnumSet.of(OPEN, ACCEPTED, IN_PROGRESS, PENDING_RESULT, DISPUTED);
    }

    public static Set<WagerStatus> closed() {
        return EnumSet.of(COMPLETED, EXPIRED, CANCELLED);
    }

    /**
     * Checks whether the edge {@code this -> target} exists in the lifecycle graph.
     * Self-transitions are not edges.
     */
    public boolean canTransitionTo(WagerStatus target) {
        Set<WagerStatus> targets = ALLOWED_TRANSITIONS.get(this);
        return targets != null && targets.contains(target);
    }
}
