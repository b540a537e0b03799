package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.config.WagerProperties;
import com.flagship.wager_escrow.wager.exception.WagerNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read side. Never locks and never transitions; a stale OPEN wager shows up
 * as {@code expired} until a write or the sweeper actually expires it.
 */
@Service
@RequiredArgsConstructor
public class WagerQueryService {

    private final WagerStore store;
    private final WagerProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Wager getWager(UUID wagerId) {
        return store.findById(wagerId).orElseThrow(() -> WagerNotFoundException.wager(wagerId));
    }

    @Transactional(readOnly = true)
    public WagerSnapshot getSnapshot(UUID wagerId) {
        return snapshotOf(getWager(wagerId));
    }

    @Transactional(readOnly = true)
    public List<WagerSnapshot> listActiveWagers(UUID userId) {
        return store.findByParticipant(userId, WagerStatus.active()).stream()
                .map(this::snapshotOf)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<WagerSnapshot> listClosedWagers(UUID userId) {
        return store.findByParticipant(userId, WagerStatus.closed()).stream()
                .map(this::snapshotOf)
                .toList();
    }

    @Transactional(readOnly = true)
    public UserWagerStats getUserStats(UUID userId) {
        return UserWagerStats.from(userId, store.totalsFor(userId));
    }

    private WagerSnapshot snapshotOf(Wager wager) {
        Instant now = Instant.now(clock);
        Duration window = properties.getDisputeWindow();
        Dispute dispute = store.findDisputeByWagerId(wager.getId()).orElse(null);

        boolean expired = wager.getStatus() == WagerStatus.EXPIRED || wager.isExpiredAt(now);
        boolean canDispute = dispute == null && wager.isResultWindowOpenAt(now, window);
        return new WagerSnapshot(wager, store.findProofs(wager.getId()), dispute,
                expired, canDispute, wager.disputeDeadline(window));
    }
}
