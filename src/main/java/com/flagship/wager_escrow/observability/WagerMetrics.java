package com.flagship.wager_escrow.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the wager lifecycle.
 *
 * <ul>
 *   <li>wager.created{result}: create attempts by outcome</li>
 *   <li>wager.transitions{from,to}: committed state changes</li>
 *   <li>wager.settled{outcome}: completed settlements</li>
 *   <li>wager.operation.duration{operation}: state machine latency</li>
 *   <li>wager.sweeper.processed{action,result}: sweeper work per wager</li>
 *   <li>escrow.operations{kind}: wallet calls actually made</li>
 *   <li>idempotency.cache{result}: Idempotency-Key lookups</li>
 * </ul>
 */
@Component
public class WagerMetrics {

    private final MeterRegistry registry;

    public WagerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCreated(String result) {
        registry.counter("wager.created", "result", sanitizeTag(result)).increment();
    }

    public void recordTransition(String from, String to) {
        registry.counter("wager.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordSettled(String outcome) {
        registry.counter("wager.settled", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRejected(String operation, String reason) {
        registry.counter("wager.rejected",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        Timer.builder("wager.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordSweep(String action, String result) {
        registry.counter("wager.sweeper.processed",
                "action", sanitizeTag(action),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordEscrowOperation(String kind) {
        registry.counter("escrow.operations", "kind", sanitizeTag(kind)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values bounded to avoid cardinality blowups.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
