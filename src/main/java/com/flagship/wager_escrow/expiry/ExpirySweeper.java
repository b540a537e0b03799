package com.flagship.wager_escrow.expiry;

import com.flagship.wager_escrow.config.WagerProperties;
import com.flagship.wager_escrow.observability.WagerMetrics;
import com.flagship.wager_escrow.wager.WagerStateMachine;
import com.flagship.wager_escrow.wager.WagerStore;
import com.flagship.wager_escrow.wager.exception.StateConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Applies the time-driven transitions nobody asked for.
 *
 * <ul>
 *   <li>OPEN wagers past {@code expires_at}: expire and refund the creator</li>
 *   <li>undisputed PENDING_RESULT wagers past the dispute window: pay the first claim</li>
 * </ul>
 * Every wager goes through the state machine in its own transaction. Losing a
 * race to a request thread shows up as a state conflict and is counted as
 * skipped; other failures are logged and the run continues. A failed wager
 * is left out of the following sweeps until its retry backoff has passed, so
 * a block of failing wagers cannot hold the batch window.
 *
 * <pre>
 * wager:
 *   sweeper:
 *     enabled: true
 *     interval-ms: 60000
 *     batch-size: 100
 *     retry-backoff: 5m
 * </pre>
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "wager.sweeper.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExpirySweeper {

    private final WagerStore store;
    private final WagerStateMachine stateMachine;
    private final WagerProperties properties;
    private final WagerMetrics metrics;
    private final Clock clock;

    private final Map<UUID, Instant> retryNotBefore = new ConcurrentHashMap<>();

    private volatile Instant lastRunAt;
    private volatile SweepResult lastResult = SweepResult.empty();

    @Scheduled(fixedRateString = "${wager.sweeper.interval-ms:60000}")
    public void runScheduled() {
        try {
            SweepResult result = sweep();
            if (result.total() > 0) {
                log.info("Sweep finished: expired={}, finalized={}, skipped={}, failed={}",
                        result.getExpired(), result.getFinalized(), result.getSkipped(), result.getFailed());
            } else {
                log.debug("Sweep found nothing to do");
            }
        } catch (Exception e) {
            log.error("Sweep failed: {}", e.getMessage(), e);
        }
    }

    public SweepResult sweep() {
        Instant now = Instant.now(clock);
        int batchSize = properties.getSweeper().getBatchSize();
        retryNotBefore.values().removeIf(until -> !until.isAfter(now));
        int backedOff = retryNotBefore.size();

        Tally expiry = process("expire", now,
                eligible(store.findExpiredOpenWagerIds(now, batchSize + backedOff), batchSize),
                stateMachine::expire);
        Tally lapse = process("finalize", now,
                eligible(store.findLapsedResultWagerIds(now.minus(properties.getDisputeWindow()),
                        batchSize + backedOff), batchSize),
                stateMachine::finalizeLapsedResult);

        SweepResult result = new SweepResult(expiry.applied, lapse.applied,
                expiry.skipped + lapse.skipped, expiry.failed + lapse.failed);
        lastRunAt = now;
        lastResult = result;
        return result;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public SweepResult getLastResult() {
        return lastResult;
    }

    /**
     * Wagers still inside their retry backoff are passed over. Candidates are
     * fetched with room for them, so the batch fills with wagers behind them.
     */
    private List<UUID> eligible(List<UUID> candidates, int batchSize) {
        return candidates.stream()
                .filter(id -> !retryNotBefore.containsKey(id))
                .limit(batchSize)
                .toList();
    }

    private Tally process(String action, Instant now, List<UUID> wagerIds, Function<UUID, ?> transition) {
        Tally tally = new Tally();
        for (UUID wagerId : wagerIds) {
            try {
                transition.apply(wagerId);
                tally.applied++;
                metrics.recordSweep(action, "applied");
            } catch (StateConflictException e) {
                tally.skipped++;
                metrics.recordSweep(action, "skipped");
                log.info("Sweeper skipped wager {} ({}): {}", wagerId, action, e.getMessage());
            } catch (Exception e) {
                tally.failed++;
                metrics.recordSweep(action, "failed");
                Instant retryAt = now.plus(properties.getSweeper().getRetryBackoff());
                retryNotBefore.put(wagerId, retryAt);
                log.error("Sweeper failed on wager {} ({}), next attempt after {}: {}",
                        wagerId, action, retryAt, e.getMessage(), e);
            }
        }
        return tally;
    }

    private static final class Tally {
        int applied;
        int skipped;
        int failed;
    }
}
