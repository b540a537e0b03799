package com.flagship.wager_escrow.wager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WagerStatusTest {

    @Test
    @DisplayName("Lifecycle graph contains exactly the documented edges")
    void allowedEdges() {
        assertTrue(WagerStatus.OPEN.canTransitionTo(WagerStatus.ACCEPTED));
        assertTrue(WagerStatus.OPEN.canTransitionTo(WagerStatus.CANCELLED));
        assertTrue(WagerStatus.OPEN.canTransitionTo(WagerStatus.EXPIRED));
        assertTrue(WagerStatus.ACCEPTED.canTransitionTo(WagerStatus.IN_PROGRESS));
        assertTrue(WagerStatus.IN_PROGRESS.canTransitionTo(WagerStatus.PENDING_RESULT));
        assertTrue(WagerStatus.PENDING_RESULT.canTransitionTo(WagerStatus.DISPUTED));
        assertTrue(WagerStatus.PENDING_RESULT.canTransitionTo(WagerStatus.COMPLETED));
        assertTrue(WagerStatus.DISPUTED.canTransitionTo(WagerStatus.COMPLETED));

        assertFalse(WagerStatus.ACCEPTED.canTransitionTo(WagerStatus.CANCELLED));
        assertFalse(WagerStatus.IN_PROGRESS.canTransitionTo(WagerStatus.COMPLETED));
        assertFalse(WagerStatus.DISPUTED.canTransitionTo(WagerStatus.PENDING_RESULT));
        assertFalse(WagerStatus.OPEN.canTransitionTo(WagerStatus.OPEN));
    }

    @ParameterizedTest
    @EnumSource(value = WagerStatus.class, names = {"COMPLETED", "EXPIRED", "CANCELLED"})
    @DisplayName("Terminal states have no outgoing edges")
    void terminalStatesAreAbsorbing(WagerStatus terminal) {
        assertTrue(terminal.isTerminal());
        for (WagerStatus target : WagerStatus.values()) {
            assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
        }
    }

    @Test
    @DisplayName("Active and closed partition the states")
    void activeAndClosedPartition() {
        Set<WagerStatus> all = EnumSet.copyOf(WagerStatus.active());
        all.addAll(WagerStatus.closed());

        assertEquals(EnumSet.allOf(WagerStatus.class), all);
        assertTrue(WagerStatus.active().stream().noneMatch(WagerStatus.closed()::contains));
    }
}
