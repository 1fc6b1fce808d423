package com.ailab;

import com.ailab.core.allocator.AllocatorProperties;
import com.ailab.core.allocator.ResourceAllocator;
import com.ailab.core.events.EnvironmentEvent;
import com.ailab.core.events.EventBus;
import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.ledger.InMemoryLedgerStore;
import com.ailab.core.lifecycle.InFlightRegistry;
import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.metrics.ErmMetrics;
import com.ailab.core.model.QuotaTier;
import com.ailab.core.quota.QuotaEngine;
import com.ailab.core.quota.QuotaProperties;
import com.ailab.core.reconcile.Reconciler;
import com.ailab.core.reconcile.ReconcilerProperties;
import com.ailab.core.telemetry.StaticGpuTelemetry;
import com.ailab.core.template.ConfiguredTemplateCatalog;
import com.ailab.core.template.EnvironmentTemplate;
import com.ailab.runtime.FakeRuntimeAdapter;
import com.ailab.runtime.RuntimeCallExecutor;
import com.ailab.runtime.RuntimeProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the manager's components the way the application context does, over an in-memory
 * ledger, a fake runtime and a fixed number of idle GPUs.
 */
public class ErmHarness implements AutoCloseable {

    public static final List<EnvironmentTemplate> TEMPLATES = List.of(
            new EnvironmentTemplate("pytorch-jupyter", "PyTorch + JupyterLab", "ai-lab-jupyter",
                    List.of(8888), 4.0, 16384, 1),
            new EnvironmentTemplate("vscode", "VS Code Development", "ai-lab-vscode",
                    List.of(8080), 2.0, 8192, 1),
            new EnvironmentTemplate("multi-gpu", "Multi-GPU Training", "ai-lab-jupyter",
                    List.of(8888), 8.0, 32768, 4),
            new EnvironmentTemplate("dual-port", "Jupyter + TensorBoard", "ai-lab-jupyter",
                    List.of(8888, 6006), 2.0, 4096, 0));

    public final Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    public final InMemoryLedgerStore store;
    public final AllocationLedger ledger;
    public final QuotaProperties quotaProperties = new QuotaProperties();
    public final AllocatorProperties allocatorProperties = new AllocatorProperties();
    public final ReconcilerProperties reconcilerProperties = new ReconcilerProperties();
    public final RuntimeProperties runtimeProperties = new RuntimeProperties();
    public final QuotaEngine quotaEngine;
    public final ResourceAllocator allocator;
    public final FakeRuntimeAdapter runtime;
    public final RuntimeCallExecutor runtimeCalls =
            new RuntimeCallExecutor(1, Duration.ofMillis(1), 1.0, Duration.ofMillis(1), Duration.ofSeconds(5));
    public final StaticGpuTelemetry gpus;
    public final InFlightRegistry inFlight = new InFlightRegistry();
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    public final ErmMetrics metrics = new ErmMetrics(meters);
    public final LifecycleManager lifecycle;
    public final Reconciler reconciler;
    public final List<EnvironmentEvent> events = new CopyOnWriteArrayList<>();

    public ErmHarness(int gpuCount) {
        this(new InMemoryLedgerStore(), new FakeRuntimeAdapter(), gpuCount);
    }

    public ErmHarness(InMemoryLedgerStore store, FakeRuntimeAdapter runtime, int gpuCount) {
        this.store = store;
        this.runtime = runtime;
        this.ledger = new AllocationLedger(store, clock);
        this.gpus = new StaticGpuTelemetry(gpuCount);
        this.quotaEngine = new QuotaEngine(ledger, quotaProperties);
        this.allocator = new ResourceAllocator(ledger, allocatorProperties);
        this.lifecycle = new LifecycleManager(ledger, quotaEngine, allocator, runtime, runtimeCalls,
                new ConfiguredTemplateCatalog(TEMPLATES), gpus, inFlight, eventBus, metrics,
                runtimeProperties, reconcilerProperties, clock);
        this.reconciler = new Reconciler(runtime, runtimeCalls, ledger, quotaEngine, inFlight, reconcilerProperties,
                runtimeProperties, eventBus, metrics, clock);
        eventBus.subscribe(events::add);
    }

    /** A fresh manager over the same store and runtime, as after a process restart. */
    public ErmHarness restart() {
        var restarted = new ErmHarness(store, runtime, gpus.utilization().size());
        restarted.quotaProperties.getUserTiers().putAll(quotaProperties.getUserTiers());
        return restarted;
    }

    public ErmHarness tier(String userId, QuotaTier tier) {
        quotaProperties.getUserTiers().put(userId, tier);
        return this;
    }

    public List<String> eventTypes() {
        return events.stream().map(EnvironmentEvent::eventType).toList();
    }

    public double counter(String name, String tagKey, String tagValue) {
        var counter = meters.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }

    @Override
    public void close() {
        runtimeCalls.close();
    }
}
