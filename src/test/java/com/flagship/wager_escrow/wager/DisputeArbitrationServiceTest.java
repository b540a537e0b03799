package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.exception.StateConflictException;
import com.flagship.wager_escrow.wager.exception.WagerNotFoundException;
import com.flagship.wager_escrow.wager.exception.WagerPermissionException;
import com.flagship.wager_escrow.wager.exception.WagerValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DisputeArbitrationServiceTest {

    private static final String REASON =
            "The screenshot is from a different match, my opponent left the lobby before the end.";

    private WagerEngineFixture fixture;
    private DisputeArbitrationService arbitration;
    private UUID creator;
    private UUID acceptor;
    private UUID moderatorA;
    private UUID moderatorB;

    @BeforeEach
    void setUp() {
        fixture = new WagerEngineFixture();
        moderatorA = UUID.randomUUID();
        moderatorB = UUID.randomUUID();
        arbitration = new DisputeArbitrationService(fixture.stateMachine, fixture.store, fixture.properties,
                TransactionOperations.withoutTransaction(), fixture.clock);
        creator = UUID.randomUUID();
        acceptor = UUID.randomUUID();
    }

    private Wager conflictingWager() {
        Wager wager = fixture.inProgressWager(creator, acceptor, 1000);
        fixture.stateMachine.submitProof(wager.getId(), creator, creator,
                "https://clips.example.com/1", EvidenceType.SCREENSHOT);
        fixture.stateMachine.submitProof(wager.getId(), acceptor, acceptor,
                "https://clips.example.com/2", EvidenceType.SCREENSHOT);
        return wager;
    }

    @Test
    @DisplayName("Without a pool the dispute stays unassigned")
    void noPool() {
        Wager wager = conflictingWager();

        Dispute dispute = arbitration.openDispute(wager.getId(), acceptor, REASON);

        assertNull(dispute.getAssignedModeratorId());
        assertEquals(dispute, arbitration.findDisputeForWager(wager.getId()).orElseThrow());
    }

    @Test
    @DisplayName("Pool assigns moderators round-robin")
    void roundRobin() {
        fixture.properties.getDispute().setModerators(List.of(moderatorA, moderatorB));

        Dispute first = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);
        Dispute second = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);
        Dispute third = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);

        assertEquals(moderatorA, first.getAssignedModeratorId());
        assertEquals(moderatorB, second.getAssignedModeratorId());
        assertEquals(moderatorA, third.getAssignedModeratorId());
        assertEquals(fixture.clock.instant(), first.getAssignedAt());
    }

    @Test
    @DisplayName("Assigned moderator resolves, others are refused")
    void resolveByAssignee() {
        fixture.properties.getDispute().setModerators(List.of(moderatorA));
        Dispute dispute = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);

        assertThrows(WagerPermissionException.class,
                () -> arbitration.resolveDispute(dispute.getId(), moderatorB, DisputeResolution.VOID, null));

        Dispute resolved = arbitration.resolveDispute(dispute.getId(), moderatorA,
                DisputeResolution.CONFIRM_ORIGINAL, "Clip is clear");
        assertEquals(moderatorA, resolved.getResolvedBy());
        assertEquals("Clip is clear", resolved.getModeratorNotes());
        assertEquals(WagerStatus.COMPLETED, fixture.reload(dispute.getWagerId()).getStatus());
    }

    @Test
    @DisplayName("Manual reassignment hands the dispute to another moderator")
    void reassign() {
        fixture.properties.getDispute().setModerators(List.of(moderatorA));
        Dispute dispute = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);
        fixture.clock.advance(Duration.ofHours(1));

        Dispute reassigned = arbitration.assignModerator(dispute.getId(), moderatorB);

        assertEquals(moderatorB, reassigned.getAssignedModeratorId());
        assertEquals(fixture.clock.instant(), reassigned.getAssignedAt());
        assertEquals(moderatorB, arbitration.getDispute(dispute.getId()).getAssignedModeratorId());
    }

    @Test
    @DisplayName("Assignment without a moderator needs a pool")
    void assignWithoutPool() {
        Dispute dispute = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);

        WagerValidationException e = assertThrows(WagerValidationException.class,
                () -> arbitration.assignModerator(dispute.getId(), null));

        assertEquals(WagerValidationException.INVALID_REQUEST, e.getReason());
    }

    @Test
    @DisplayName("Resolved dispute cannot be reassigned")
    void assignResolved() {
        Dispute dispute = arbitration.openDispute(conflictingWager().getId(), acceptor, REASON);
        arbitration.resolveDispute(dispute.getId(), moderatorA, DisputeResolution.VOID, null);

        StateConflictException e = assertThrows(StateConflictException.class,
                () -> arbitration.assignModerator(dispute.getId(), moderatorB));

        assertEquals(StateConflictException.DISPUTE_ALREADY_RESOLVED, e.getReason());
    }

    @Test
    @DisplayName("Unknown dispute is not found")
    void unknownDispute() {
        assertThrows(WagerNotFoundException.class, () -> arbitration.getDispute(UUID.randomUUID()));
        assertThrows(WagerNotFoundException.class, () -> arbitration.assignModerator(UUID.randomUUID(), moderatorA));
    }
}
