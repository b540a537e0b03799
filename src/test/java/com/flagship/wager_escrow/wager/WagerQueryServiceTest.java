package com.flagship.wager_escrow.wager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WagerQueryServiceTest {

    private static final String REASON =
            "The screenshot is from a different match, my opponent left the lobby before the end.";

    private WagerEngineFixture fixture;
    private WagerQueryService queryService;
    private UUID creator;
    private UUID acceptor;

    @BeforeEach
    void setUp() {
        fixture = new WagerEngineFixture();
        queryService = new WagerQueryService(fixture.store, fixture.properties, fixture.clock);
        creator = UUID.randomUUID();
        acceptor = UUID.randomUUID();
    }

    private void proof(UUID wagerId, UUID submitter, UUID claimedWinner) {
        fixture.stateMachine.submitProof(wagerId, submitter, claimedWinner,
                "https://clips.example.com/1", EvidenceType.VIDEO);
    }

    @Test
    @DisplayName("Stale OPEN wager reads as expired without being transitioned")
    void staleOpenWagerReadsExpired() {
        Wager wager = fixture.openWager(creator, 1000);
        fixture.clock.set(wager.getExpiresAt().plusSeconds(1));

        WagerSnapshot snapshot = queryService.getSnapshot(wager.getId());

        assertTrue(snapshot.isExpired());
        assertEquals(WagerStatus.OPEN, snapshot.getWager().getStatus());
        assertEquals(1000, fixture.wallet.escrowOf(creator));
    }

    @Test
    @DisplayName("can_dispute follows the result window and an existing dispute")
    void canDispute() {
        Wager wager = fixture.inProgressWager(creator, acceptor, 1000);
        proof(wager.getId(), creator, creator);

        WagerSnapshot pending = queryService.getSnapshot(wager.getId());
        assertTrue(pending.isCanDispute());
        assertEquals(fixture.clock.instant().plus(Duration.ofHours(24)), pending.getDisputeDeadline());
        assertEquals(1, pending.getProofs().size());

        fixture.stateMachine.openDispute(wager.getId(), acceptor, REASON);
        WagerSnapshot disputed = queryService.getSnapshot(wager.getId());
        assertFalse(disputed.isCanDispute());
        assertNotNull(disputed.getDispute());
    }

    @Test
    @DisplayName("Lapsed window cannot be disputed even before the sweeper runs")
    void lapsedWindow() {
        Wager wager = fixture.inProgressWager(creator, acceptor, 1000);
        proof(wager.getId(), creator, creator);
        fixture.clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertFalse(queryService.getSnapshot(wager.getId()).isCanDispute());
    }

    @Test
    @DisplayName("Active and closed lists split a user's wagers")
    void activeAndClosed() {
        Wager active = fixture.openWager(creator, 1000);
        Wager cancelled = fixture.openWager(creator, 500);
        fixture.stateMachine.cancel(cancelled.getId(), creator);

        List<WagerSnapshot> activeList = queryService.listActiveWagers(creator);
        List<WagerSnapshot> closedList = queryService.listClosedWagers(creator);

        assertEquals(List.of(active.getId()), activeList.stream().map(s -> s.getWager().getId()).toList());
        assertEquals(List.of(cancelled.getId()), closedList.stream().map(s -> s.getWager().getId()).toList());
        assertTrue(queryService.listActiveWagers(acceptor).isEmpty());
    }

    @Test
    @DisplayName("Stats count wins, losses and earnings over settled wagers")
    void stats() {
        Wager won = fixture.inProgressWager(creator, acceptor, 1000);
        proof(won.getId(), creator, creator);
        proof(won.getId(), acceptor, creator);

        Wager lost = fixture.inProgressWager(creator, acceptor, 2000);
        proof(lost.getId(), creator, acceptor);
        proof(lost.getId(), acceptor, acceptor);

        Wager third = fixture.inProgressWager(creator, acceptor, 500);
        proof(third.getId(), creator, creator);
        proof(third.getId(), acceptor, creator);

        UserWagerStats stats = queryService.getUserStats(creator);

        assertEquals(3, stats.getCreated());
        assertEquals(0, stats.getAccepted());
        assertEquals(2, stats.getWon());
        assertEquals(1, stats.getLost());
        assertEquals(66.7, stats.getWinRate());
        assertEquals(950 + 475, stats.getTotalEarnings());
        assertEquals(3500, stats.getTotalWagered());

        UserWagerStats acceptorStats = queryService.getUserStats(acceptor);
        assertEquals(3, acceptorStats.getAccepted());
        assertEquals(33.3, acceptorStats.getWinRate());
    }

    @Test
    @DisplayName("User without settled wagers has a zero win rate")
    void emptyStats() {
        UserWagerStats stats = queryService.getUserStats(UUID.randomUUID());

        assertEquals(0, stats.getCreated());
        assertEquals(0.0, stats.getWinRate());
    }
}
