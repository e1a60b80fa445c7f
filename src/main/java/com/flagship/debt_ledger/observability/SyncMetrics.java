package com.flagship.debt_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for repayment synchronization.
 *
 * Metrics exposed:
 * - debt.sync.repayments.applied: repayments newly applied by sync passes
 * - debt.sync.positions: positions visited by sync, tagged by outcome
 * - debt.sync.latency: duration of sync operations, tagged by operation
 * - debt.repayment_log.degraded: stored logs discarded as unreadable
 */
@Component
public class SyncMetrics {

    public static final String OUTCOME_APPLIED = "applied";
    public static final String OUTCOME_UNCHANGED = "unchanged";
    public static final String OUTCOME_SEEDED = "seeded";
    public static final String OUTCOME_SKIPPED = "skipped";

    private final MeterRegistry registry;

    private final Counter repaymentsApplied;
    private final Counter degradedLoads;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.repaymentsApplied = Counter.builder("debt.sync.repayments.applied")
                .description("Number of scheduled repayments applied by sync")
                .register(registry);

        this.degradedLoads = Counter.builder("debt.repayment_log.degraded")
                .description("Number of unreadable repayment logs replaced by an empty log")
                .register(registry);
    }

    public void recordRepaymentsApplied(int count) {
        if (count > 0) {
            repaymentsApplied.increment(count);
        }
    }

    /**
     * Records the outcome of syncing one position.
     */
    public void recordPositionSynced(String outcome) {
        registry.counter("debt.sync.positions", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSyncLatency(String operation, long durationMs) {
        registry.timer("debt.sync.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordDegradedLoad() {
        degradedLoads.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
