package com.flagship.gambling_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics for ledger operations, exclusion changes and access decisions.
 *
 * Metrics exposed:
 * - ledger.operations.applied{operation, asset}
 * - ledger.operations.replayed
 * - ledger.operations.rejected{operation, reason}
 * - ledger.update.duration: end-to-end updateBalance time, lock wait included
 * - self_exclusion.changes{type, event}
 * - guard.denied{policy, reason}
 * - outbox.event.published / outbox.event.publish.failure{event_type}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter replays;
    private final Timer updateTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replays = Counter.builder("ledger.operations.replayed")
                .description("Number of updateBalance calls answered from a stored operation")
                .register(registry);

        this.updateTimer = Timer.builder("ledger.update.duration")
                .description("Time taken to apply a balance operation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordApplied(String operation, String asset) {
        registry.counter("ledger.operations.applied",
                "operation", sanitizeTag(operation),
                "asset", sanitizeTag(asset)
        ).increment();
    }

    public void recordReplay() {
        replays.increment();
    }

    public void recordRejected(String operation, String reason) {
        registry.counter("ledger.operations.rejected",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public <T> T timeUpdate(Supplier<T> operation) {
        return updateTimer.record(operation);
    }

    // ==================== Exclusions and guards ====================

    public void recordExclusionChange(String type, String eventType) {
        registry.counter("self_exclusion.changes",
                "type", sanitizeTag(type),
                "event", sanitizeTag(eventType)
        ).increment();
    }

    public void recordGuardDenied(String policy, String reason) {
        registry.counter("guard.denied",
                "policy", sanitizeTag(policy),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    // ==================== Outbox ====================

    public void recordEventPublished(String eventType) {
        Counter.builder("outbox.event.published")
                .tag("event_type", sanitizeTag(eventType))
                .register(registry)
                .increment();
    }

    public void recordEventPublishFailure(String eventType) {
        Counter.builder("outbox.event.publish.failure")
                .tag("event_type", sanitizeTag(eventType))
                .register(registry)
                .increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
