package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.exception.StateConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofHours(24);

    private UUID creator;
    private UUID acceptor;
    private Wager open;

    @BeforeEach
    void setUp() {
        creator = UUID.randomUUID();
        acceptor = UUID.randomUUID();
        open = Wager.open(UUID.randomUUID(), creator, 1000, "chess", null, null, null,
                NOW, Duration.ofHours(72));
    }

    @Test
    @DisplayName("Open wager expires strictly after expires_at")
    void expiryBoundary() {
        assertFalse(open.isExpiredAt(open.getExpiresAt()));
        assertTrue(open.isExpiredAt(open.getExpiresAt().plusSeconds(1)));
        assertFalse(open.accept(acceptor, NOW).isExpiredAt(open.getExpiresAt().plusSeconds(1)));
    }

    @Test
    @DisplayName("Result window includes its deadline and lapses one second later")
    void resultWindowBoundary() {
        Wager pending = open.accept(acceptor, NOW).start(NOW).markResultSubmitted(NOW);
        Instant deadline = NOW.plus(WINDOW);

        assertEquals(deadline, pending.disputeDeadline(WINDOW));
        assertTrue(pending.isResultWindowOpenAt(deadline, WINDOW));
        assertFalse(pending.hasLapsedResultWindowAt(deadline, WINDOW));
        assertFalse(pending.isResultWindowOpenAt(deadline.plusSeconds(1), WINDOW));
        assertTrue(pending.hasLapsedResultWindowAt(deadline.plusSeconds(1), WINDOW));
    }

    @Test
    @DisplayName("Transitions return new instances and leave the original untouched")
    void immutability() {
        Wager accepted = open.accept(acceptor, NOW);

        assertEquals(WagerStatus.OPEN, open.getStatus());
        assertNull(open.getAcceptorId());
        assertEquals(WagerStatus.ACCEPTED, accepted.getStatus());
        assertEquals(acceptor, accepted.getAcceptorId());
    }

    @Test
    @DisplayName("Illegal edge raises a state conflict carrying the current state")
    void illegalEdge() {
        StateConflictException e = assertThrows(StateConflictException.class, () -> open.start(NOW));

        assertEquals(StateConflictException.ILLEGAL_TRANSITION, e.getReason());
        assertEquals(WagerStatus.OPEN, e.getCurrentState());
    }

    @Test
    @DisplayName("Winner must be a participant and the split must add up to the stake")
    void completionGuards() {
        Wager pending = open.accept(acceptor, NOW).start(NOW).markResultSubmitted(NOW);

        assertThrows(IllegalArgumentException.class,
                () -> pending.completeWithWinner(UUID.randomUUID(), 950, 50, NOW));
        assertThrows(IllegalArgumentException.class,
                () -> pending.completeWithWinner(acceptor, 950, 49, NOW));

        Wager paid = pending.completeWithWinner(acceptor, 950, 50, NOW);
        assertEquals(SettlementOutcome.WINNER_PAID, paid.getSettlementOutcome());
        assertTrue(paid.getStatus().isTerminal());
    }

    @Test
    @DisplayName("Void completion returns the whole stake with no winner")
    void voidCompletion() {
        Wager disputed = open.accept(acceptor, NOW).start(NOW).markResultSubmitted(NOW).dispute();

        Wager voided = disputed.completeVoid(NOW);

        assertNull(voided.getWinnerId());
        assertEquals(1000L, voided.getPayoutAmount());
        assertEquals(0L, voided.getPlatformFee());
        assertEquals(SettlementOutcome.VOID_REFUNDED, voided.getSettlementOutcome());
    }

    @Test
    @DisplayName("Counterparty lookup")
    void counterparty() {
        Wager accepted = open.accept(acceptor, NOW);

        assertEquals(acceptor, accepted.counterpartyOf(creator));
        assertEquals(creator, accepted.counterpartyOf(acceptor));
        assertNull(accepted.counterpartyOf(UUID.randomUUID()));
        assertNull(accepted.counterpartyOf(null));
    }
}
