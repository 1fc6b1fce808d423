package com.ailab.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for allocation, access control and reconciliation.
 */
@Service
public class ErmMetrics {

    private final MeterRegistry registry;

    public ErmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code success} or the error code that ended the request
     */
    public void recordAllocation(String outcome) {
        Counter.builder("ailab.allocations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordQuotaDenial(String reason) {
        Counter.builder("ailab.quota.denials")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAccessDenied(String operation) {
        Counter.builder("ailab.access.denials")
                .description("Operations refused because the caller neither owns the environment nor is an admin")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordRuntimeCall(String operation, long ms, boolean success) {
        Timer.builder("ailab.runtime.call.duration")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param kind {@code stale}, {@code orphan}, {@code drift}, {@code conflict} or {@code index}
     */
    public void recordReconcileRepair(String kind) {
        Counter.builder("ailab.reconcile.repairs")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordReconcilePass(long ms, boolean clean) {
        Timer.builder("ailab.reconcile.duration")
                .tag("clean", String.valueOf(clean))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLedgerCorruption() {
        Counter.builder("ailab.ledger.corruption")
                .description("Ledger index mismatches and unreadable entries detected")
                .register(registry)
                .increment();
    }
}
