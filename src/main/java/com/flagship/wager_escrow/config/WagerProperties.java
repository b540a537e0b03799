package com.flagship.wager_escrow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Tunables for the wager engine, bound from the {@code wager.*} namespace.
 *
 * <pre>
 * wager:
 *   stake:
 *     min: 100
 *     max: 50000
 *   acceptance-window: 72h
 *   dispute-window: 24h
 *   platform-fee-basis-points: 500
 *   dispute:
 *     min-reason-length: 50
 *     moderators: []
 *   limits:
 *     max-created-per-window: 10
 *     creation-window: 24h
 *     max-open-acceptances: 3
 *   sweeper:
 *     batch-size: 100
 *     retry-backoff: 5m
 * </pre>
 */
@ConfigurationProperties(prefix = "wager")
@Getter
@Setter
public class WagerProperties {

    private Stake stake = new Stake();

    private Duration acceptanceWindow = Duration.ofHours(72);

    private Duration disputeWindow = Duration.ofHours(24);

    /**
     * Platform cut of a settled stake, in 1/10000ths. 500 means the winner gets 95%.
     */
    private int platformFeeBasisPoints = 500;

    private DisputeSettings dispute = new DisputeSettings();

    private Limits limits = new Limits();

    private Sweeper sweeper = new Sweeper();

    @Getter
    @Setter
    public static class Stake {
        private long min = 100;
        private long max = 50_000;
    }

    @Getter
    @Setter
    public static class DisputeSettings {
        private int minReasonLength = 50;

        /**
         * Round-robin pool for automatic assignment. Empty disables auto-assignment.
         */
        private List<UUID> moderators = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Limits {
        private int maxCreatedPerWindow = 10;
        private Duration creationWindow = Duration.ofHours(24);
        private int maxOpenAcceptances = 3;
    }

    @Getter
    @Setter
    public static class Sweeper {
        private int batchSize = 100;

        /**
         * How long a wager that failed in a sweep is left out of later sweeps.
         */
        private Duration retryBackoff = Duration.ofMinutes(5);
    }
}
