package com.flagship.wager_escrow.observability;

import com.flagship.wager_escrow.expiry.ExpirySweeper;
import com.flagship.wager_escrow.expiry.SweepResult;
import com.flagship.wager_escrow.outbox.OutboxService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Actuator health checks for the outbox relay, Redis and the expiry sweeper.
 */
public class HealthIndicators {

    /**
     * DOWN when the outbox backlog passes the critical threshold.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxService.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage is DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : Health.status("DEGRADED")
                                    .withDetail("response", result != null ? result : "null")
                                    .withDetail("note", FALLBACK_NOTE)
                                    .build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * DOWN when the sweeper has not completed a run for several intervals.
     * Reports UNKNOWN when the sweeper is disabled.
     */
    @Component("sweeperHealth")
    public static class SweeperHealthIndicator implements HealthIndicator {

        private static final int MISSED_RUNS_TOLERATED = 5;

        private final ObjectProvider<ExpirySweeper> sweeper;
        private final Clock clock;
        private final Duration interval;

        public SweeperHealthIndicator(ObjectProvider<ExpirySweeper> sweeper,
                                      Clock clock,
                                      @Value("${wager.sweeper.interval-ms:60000}") long intervalMs) {
            this.sweeper = sweeper;
            this.clock = clock;
            this.interval = Duration.ofMillis(intervalMs);
        }

        @Override
        public Health health() {
            ExpirySweeper expirySweeper = sweeper.getIfAvailable();
            if (expirySweeper == null) {
                return Health.unknown().withDetail("enabled", false).build();
            }

            Instant lastRun = expirySweeper.getLastRunAt();
            SweepResult lastResult = expirySweeper.getLastResult();
            if (lastRun == null) {
                return Health.up().withDetail("lastRun", "never").build();
            }

            Duration sinceLastRun = Duration.between(lastRun, Instant.now(clock));
            Health.Builder builder = sinceLastRun.compareTo(interval.multipliedBy(MISSED_RUNS_TOLERATED)) > 0
                    ? Health.down()
                    : Health.up();
            return builder
                    .withDetail("lastRun", lastRun.toString())
                    .withDetail("expired", lastResult.getExpired())
                    .withDetail("finalized", lastResult.getFinalized())
                    .withDetail("skipped", lastResult.getSkipped())
                    .withDetail("failed", lastResult.getFailed())
                    .build();
        }
    }
}
