package com.ailab.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ErmMetricsTest {

    private SimpleMeterRegistry registry;
    private ErmMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ErmMetrics(registry);
    }

    @Test
    @DisplayName("recordAllocation counts by outcome")
    void recordAllocation() {
        metrics.recordAllocation("success");
        metrics.recordAllocation("success");
        metrics.recordAllocation("PORTS_EXHAUSTED");

        assertEquals(2.0, registry.find("ailab.allocations.total").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.find("ailab.allocations.total").tag("outcome", "PORTS_EXHAUSTED").counter().count());
    }

    @Test
    @DisplayName("recordQuotaDenial counts by reason")
    void recordQuotaDenial() {
        metrics.recordQuotaDenial("gpu_quota_exceeded");

        var counter = registry.find("ailab.quota.denials").tag("reason", "gpu_quota_exceeded").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAccessDenied counts by operation")
    void recordAccessDenied() {
        metrics.recordAccessDenied("destroy");

        assertEquals(1.0, registry.find("ailab.access.denials").tag("operation", "destroy").counter().count());
    }

    @Test
    @DisplayName("recordRuntimeCall times calls by operation and outcome")
    void recordRuntimeCall() {
        metrics.recordRuntimeCall("create", 250, true);
        metrics.recordRuntimeCall("create", 750, false);

        var ok = registry.find("ailab.runtime.call.duration").tag("operation", "create").tag("success", "true").timer();
        assertNotNull(ok);
        assertEquals(1, ok.count());
        assertEquals(250.0, ok.totalTime(TimeUnit.MILLISECONDS), 0.01);
    }

    @Test
    @DisplayName("reconciliation repairs and passes are recorded")
    void reconcile() {
        metrics.recordReconcileRepair("orphan");
        metrics.recordReconcilePass(120, false);
        metrics.recordLedgerCorruption();

        assertEquals(1.0, registry.find("ailab.reconcile.repairs").tag("kind", "orphan").counter().count());
        assertEquals(1, registry.find("ailab.reconcile.duration").tag("clean", "false").timer().count());
        assertEquals(1.0, registry.find("ailab.ledger.corruption").counter().count());
    }
}
