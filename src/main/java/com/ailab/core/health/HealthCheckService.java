package com.ailab.core.health;

import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.reconcile.Reconciler;
import com.ailab.core.reconcile.ReconcilerProperties;
import com.ailab.core.reconcile.ReconciliationReport;
import com.ailab.core.telemetry.GpuTelemetry;
import com.ailab.runtime.RuntimeAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AllocationLedger ledger;
    private final RuntimeAdapter runtime;
    private final Reconciler reconciler;
    private final ReconcilerProperties reconcilerProperties;
    private final GpuTelemetry gpuTelemetry;
    private final Clock clock;

    public HealthCheckService(AllocationLedger ledger,
                              RuntimeAdapter runtime,
                              Reconciler reconciler,
                              ReconcilerProperties reconcilerProperties,
                              GpuTelemetry gpuTelemetry,
                              Clock clock) {
        this.ledger = ledger;
        this.runtime = runtime;
        this.reconciler = reconciler;
        this.reconcilerProperties = reconcilerProperties;
        this.gpuTelemetry = gpuTelemetry;
        this.clock = clock;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLedger());
        results.add(checkRuntime());
        results.add(checkReconciler());
        results.add(checkGpus());
        return results;
    }

    private HealthStatus checkLedger() {
        var metadata = Map.of("store", ledger.storeDescription());
        if (!ledger.isStoreWritable()) {
            return HealthStatus.down("ledger", "Ledger store is not writable", metadata);
        }
        int quarantined = ledger.quarantined().size();
        if (quarantined > 0) {
            return HealthStatus.degraded("ledger", quarantined + " unreadable entries quarantined", metadata);
        }
        return HealthStatus.up("ledger", ledger.listAll().size() + " environments tracked", metadata);
    }

    private HealthStatus checkRuntime() {
        try {
            if (runtime.ping()) {
                return HealthStatus.up("runtime", "Runtime reachable (" + runtime.getClass().getSimpleName() + ")", Map.of());
            }
            return HealthStatus.down("runtime", "Runtime did not answer", Map.of());
        } catch (Exception e) {
            log.warn("Runtime health check failed: {}", e.getMessage());
            return HealthStatus.down("runtime", "Runtime error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkReconciler() {
        ReconciliationReport last = reconciler.lastReport().orElse(null);
        if (last == null) {
            return HealthStatus.degraded("reconciler", "No pass completed yet", Map.of());
        }
        Duration age = Duration.between(last.finishedAt(), clock.instant());
        var metadata = Map.of(
                "lastPass", String.valueOf(last.pass()),
                "ageSeconds", String.valueOf(age.toSeconds()),
                "repairs", String.valueOf(last.repairs()));
        if (age.compareTo(reconcilerProperties.getInterval().multipliedBy(3)) > 0) {
            return HealthStatus.degraded("reconciler", "Last pass finished " + age.toSeconds() + "s ago", metadata);
        }
        if (!last.errors().isEmpty()) {
            return HealthStatus.degraded("reconciler", last.errors().size() + " entries could not be reconciled", metadata);
        }
        return HealthStatus.up("reconciler", "Last pass clean or repaired", metadata);
    }

    private HealthStatus checkGpus() {
        try {
            int count = gpuTelemetry.utilization().size();
            return HealthStatus.up("gpus", count + " GPUs reported",
                    Map.of("count", String.valueOf(count)));
        } catch (Exception e) {
            log.warn("GPU telemetry health check failed: {}", e.getMessage());
            return HealthStatus.degraded("gpus", "GPU telemetry error: " + e.getMessage(), Map.of());
        }
    }
}
