package com.ailab.core.reconcile;

import com.ailab.core.events.EnvironmentEvent;
import com.ailab.core.events.EventBus;
import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.ledger.IndexVerification;
import com.ailab.core.ledger.LedgerSnapshot;
import com.ailab.core.lifecycle.InFlightRegistry;
import com.ailab.core.logging.MdcContext;
import com.ailab.core.metrics.ErmMetrics;
import com.ailab.core.model.Environment;
import com.ailab.core.model.EnvironmentStatus;
import com.ailab.core.model.PortMapping;
import com.ailab.core.quota.QuotaDecision;
import com.ailab.core.quota.QuotaEngine;
import com.ailab.runtime.ContainerLabels;
import com.ailab.runtime.ContainerNotFoundException;
import com.ailab.runtime.LiveContainer;
import com.ailab.runtime.RuntimeAdapter;
import com.ailab.runtime.RuntimeCallExecutor;
import com.ailab.runtime.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Aligns the ledger with what the container runtime actually runs.
 *
 * <p>A pass lists live containers, snapshots the ledger and diffs the two:
 * <ol>
 *   <li>Active entries without a container are marked {@code FAILED}, freeing their resources.</li>
 *   <li>Containers without an entry are adopted with their live bindings.</li>
 *   <li>Entries whose status disagrees with their container are corrected.</li>
 *   <li>A port or GPU held by two active entries is resolved by quarantining one of them.</li>
 *   <li>The stored allocation indexes are verified against the entries and rebuilt if they differ.</li>
 * </ol>
 *
 * <p>Passes are mutually exclusive. Each repair is applied under the ledger write lock and
 * only if the entry is still exactly what the snapshot showed; entries with a lifecycle
 * call in flight are skipped. A failure on one entry is recorded and the pass continues.
 *
 * <p>The container list is taken before the snapshot, so an entry that became active in
 * between has no listed container. Such an entry is inspected individually and only
 * failed once the runtime confirms its container does not exist.
 */
@Service
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    static final String REASON_CONTAINER_MISSING = "container_missing";
    static final String REASON_INTERRUPTED = "interrupted";
    static final String REASON_CONFLICT = "resource_conflict";

    private enum Revival { RESTORED, REASSIGNED, QUARANTINED, SKIPPED }

    private final RuntimeAdapter runtime;
    private final RuntimeCallExecutor runtimeCalls;
    private final AllocationLedger ledger;
    private final QuotaEngine quotaEngine;
    private final InFlightRegistry inFlight;
    private final ReconcilerProperties properties;
    private final RuntimeProperties runtimeProperties;
    private final EventBus eventBus;
    private final ErmMetrics metrics;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicLong passCounter = new AtomicLong();
    private volatile ReconciliationReport lastReport;

    public Reconciler(RuntimeAdapter runtime,
                      RuntimeCallExecutor runtimeCalls,
                      AllocationLedger ledger,
                      QuotaEngine quotaEngine,
                      InFlightRegistry inFlight,
                      ReconcilerProperties properties,
                      RuntimeProperties runtimeProperties,
                      EventBus eventBus,
                      ErmMetrics metrics,
                      Clock clock) {
        this.runtime = runtime;
        this.runtimeCalls = runtimeCalls;
        this.ledger = ledger;
        this.quotaEngine = quotaEngine;
        this.inFlight = inFlight;
        this.properties = properties;
        this.runtimeProperties = runtimeProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs one pass, waiting for a concurrent pass to finish first.
     *
     * @throws com.ailab.runtime.RuntimeUnavailableException if the runtime cannot be listed;
     *         nothing is changed in that case
     */
    public ReconciliationReport reconcile() {
        passLock.lock();
        try {
            long pass = passCounter.incrementAndGet();
            MdcContext.setReconcilePass(pass);
            try {
                ReconciliationReport report = runPass(pass);
                lastReport = report;
                metrics.recordReconcilePass(report.duration().toMillis(), report.clean());
                if (report.clean()) {
                    log.debug("Reconciliation pass {} found nothing to repair", pass);
                } else {
                    log.info("Reconciliation pass {}: {} stale, {} adopted, {} drift, {} conflicts, index repaired={}, {} errors",
                            pass, report.staleFailed().size(), report.orphansAdopted().size(),
                            report.driftCorrected().size(), report.conflictsQuarantined().size(),
                            report.indexRepaired(), report.errors().size());
                }
                eventBus.publish(new EnvironmentEvent(EnvironmentEvent.RECONCILED, null, null,
                        Map.of("pass", pass, "repairs", report.repairs(), "errors", report.errors().size()),
                        report.finishedAt()));
                return report;
            } finally {
                MdcContext.clear();
            }
        } finally {
            passLock.unlock();
        }
    }

    public Optional<ReconciliationReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    private ReconciliationReport runPass(long pass) {
        Instant startedAt = clock.instant();
        String prefix = runtimeProperties.getNamePrefix();
        List<LiveContainer> live = runtimeCalls.call("list", prefix, () -> runtime.listAll(prefix));
        LedgerSnapshot snapshot = ledger.snapshot();
        var result = new PassResult();

        Map<String, LiveContainer> byHandle = index(live, LiveContainer::runtimeHandle);
        Map<String, LiveContainer> byName = index(live, LiveContainer::name);
        Map<String, LiveContainer> byEnvLabel = index(live, c -> c.label(ContainerLabels.ENV_ID));
        var matched = new HashMap<String, LiveContainer>();

        for (Environment env : snapshot.environments().values()) {
            LiveContainer container = match(env, byHandle, byName, byEnvLabel);
            if (container != null) {
                matched.put(container.runtimeHandle(), container);
            }
            if (inFlight.contains(env.id())) {
                result.skippedInFlight.add(env.id());
                continue;
            }
            guarded(result, env.id(), () -> {
                if (container == null) {
                    failStale(env, result);
                } else {
                    correctDrift(env, container, result);
                }
            });
        }

        for (LiveContainer container : live) {
            if (!matched.containsKey(container.runtimeHandle())) {
                guarded(result, container.name(), () -> adopt(container, result));
            }
        }

        guarded(result, "conflicts", () -> resolveConflicts(byHandle, byName, byEnvLabel, result));
        guarded(result, "index", () -> verifyIndexes(result));

        for (String id : ledger.quarantined().keySet()) {
            log.error("Ledger entry {} is quarantined as unreadable and needs operator attention", id);
            metrics.recordLedgerCorruption();
            result.quarantined.add(id);
        }

        return new ReconciliationReport(pass, startedAt, clock.instant(), live.size(),
                snapshot.environments().size(), result.stale, result.adopted, result.drift, result.conflicts,
                result.indexRepaired, result.quarantined, result.skippedInFlight, result.errors);
    }

    private void failStale(Environment env, PassResult result) {
        if (!env.holdsResources()) {
            return;
        }
        if (containerExists(env)) {
            log.debug("Environment {} was not listed but its container exists; leaving it for the next pass", env.id());
            return;
        }
        Environment failed = env.failed(REASON_CONTAINER_MISSING, clock.instant());
        if (replaceIfUnchanged(env, failed)) {
            log.warn("Environment {} is {} but has no container; marked FAILED, released ports {} and GPUs {}",
                    env.id(), env.status(), env.hostPorts(), env.allocatedGpuIndices());
            metrics.recordReconcileRepair("stale");
            publish(EnvironmentEvent.STALE_FAILED, failed, Map.of("previousStatus", env.status().name()));
            result.stale.add(env.id());
        }
    }

    private boolean containerExists(Environment env) {
        try {
            runtimeCalls.call("inspect", env.runtimeRef(), () -> runtime.inspect(env.runtimeRef()));
            return true;
        } catch (ContainerNotFoundException e) {
            return false;
        }
    }

    private void correctDrift(Environment env, LiveContainer container, PassResult result) {
        Instant now = clock.instant();
        if ((env.status() == EnvironmentStatus.STOPPED || env.status() == EnvironmentStatus.FAILED)
                && container.isRunning()) {
            revive(env, container, now, result);
            return;
        }
        Environment corrected = switch (env.status()) {
            case RUNNING -> container.isRunning()
                    ? (env.runtimeHandle() == null ? env.withRuntimeHandle(container.runtimeHandle()) : null)
                    : env.stopped(now);
            case STOPPED, FAILED -> null;
            case CREATING, STOPPING -> container.isRunning()
                    ? env.running(container.runtimeHandle(), now)
                    : env.status() == EnvironmentStatus.STOPPING ? env.stopped(now) : env.failed(REASON_INTERRUPTED, now);
            case REQUESTED -> env.failed(REASON_INTERRUPTED, now);
            case ORPHANED -> null;
        };
        if (corrected == null || corrected.equals(env)) {
            return;
        }
        if (replaceIfUnchanged(env, corrected)) {
            log.info("Environment {} drifted: ledger {} but container {}; now {}",
                    env.id(), env.status(), container.status(), corrected.status());
            metrics.recordReconcileRepair("drift");
            publish(EnvironmentEvent.DRIFT_CORRECTED, corrected, Map.of(
                    "from", env.status().name(),
                    "to", corrected.status().name(),
                    "container", container.status() == null ? "unknown" : container.status()));
            result.drift.add(env.id());
        }
    }

    /**
     * A STOPPED or FAILED entry whose container runs again. Its live bindings are counted
     * again only if no other active entry holds them, and against its owner only if the
     * owner's quota allows it; otherwise the environment goes to the default owner, so an
     * admin has to claim it. Bindings held elsewhere quarantine the entry instead.
     */
    private void revive(Environment env, LiveContainer container, Instant now, PassResult result) {
        Environment revived = env.withBindings(container.portBindings(), container.gpuIndices())
                .running(container.runtimeHandle(), now);
        var outcome = new AtomicReference<Environment>();
        Revival revival = ledger.inWriteTransaction(() -> {
            Optional<Environment> current = ledger.get(env.id());
            if (current.isEmpty() || !current.get().equals(env) || inFlight.contains(env.id())) {
                return Revival.SKIPPED;
            }
            if (heldElsewhere(revived)) {
                outcome.set(env.withBindings(container.portBindings(), container.gpuIndices()).quarantined(REASON_CONFLICT));
                ledger.upsert(outcome.get());
                return Revival.QUARANTINED;
            }
            String owner = env.ownerId();
            if (!owner.equals(properties.getDefaultOwner())) {
                int memoryMb = env.resourceLimits() != null ? env.resourceLimits().memoryMb() : 0;
                QuotaDecision decision = quotaEngine.canAllocate(owner, revived.gpuCount(), memoryMb);
                if (!decision.allowed()) {
                    outcome.set(revived.withOwner(properties.getDefaultOwner()));
                    ledger.upsert(outcome.get());
                    log.warn("Environment {} of {} restarted outside the manager but exceeds quota ({}); now held by {}",
                            env.id(), owner, decision.message(), properties.getDefaultOwner());
                    return Revival.REASSIGNED;
                }
            }
            outcome.set(revived);
            ledger.upsert(revived);
            return Revival.RESTORED;
        });

        switch (revival) {
            case SKIPPED -> log.debug("Skipping repair of {}: changed since snapshot", env.id());
            case QUARANTINED -> {
                log.warn("Quarantined {}: its restarted container binds ports {} / GPUs {} held by another environment",
                        env.id(), outcome.get().hostPorts(), outcome.get().allocatedGpuIndices());
                metrics.recordReconcileRepair("conflict");
                publish(EnvironmentEvent.CONFLICT_QUARANTINED, outcome.get(), Map.of("from", env.status().name()));
                result.conflicts.add(env.id());
            }
            case RESTORED, REASSIGNED -> {
                log.info("Environment {} drifted: ledger {} but container {}; now RUNNING for {}",
                        env.id(), env.status(), container.status(), outcome.get().ownerId());
                metrics.recordReconcileRepair("drift");
                publish(EnvironmentEvent.DRIFT_CORRECTED, outcome.get(), Map.of(
                        "from", env.status().name(),
                        "to", EnvironmentStatus.RUNNING.name(),
                        "container", container.status() == null ? "unknown" : container.status(),
                        "reassignedFrom", revival == Revival.REASSIGNED ? env.ownerId() : ""));
                result.drift.add(env.id());
            }
        }
    }

    private boolean heldElsewhere(Environment revived) {
        Set<Integer> ports = ledger.allocatedHostPorts();
        Set<Integer> gpus = ledger.allocatedGpuIndices();
        return revived.allocatedPorts().stream().map(PortMapping::hostPort).anyMatch(ports::contains)
                || revived.allocatedGpuIndices().stream().anyMatch(gpus::contains);
    }

    private void adopt(LiveContainer container, PassResult result) {
        String envId = container.name().isEmpty() ? container.runtimeHandle() : container.name();
        boolean managed = ContainerLabels.isManaged(container.labels());
        String labelOwner = container.label(ContainerLabels.OWNER);
        String owner = properties.isTrustOwnerLabels() && managed && labelOwner != null && !labelOwner.isBlank()
                ? labelOwner
                : properties.getDefaultOwner();
        String template = Objects.requireNonNullElse(container.label(ContainerLabels.TEMPLATE), "unknown");
        Instant now = clock.instant();

        Environment adopted = new Environment(envId, owner, template,
                container.isRunning() ? EnvironmentStatus.RUNNING : EnvironmentStatus.STOPPED,
                container.portBindings(), container.gpuIndices(), null, container.runtimeHandle(), null,
                now, container.isRunning() ? now : null, container.isRunning() ? null : now);

        boolean added = ledger.inWriteTransaction(() -> {
            if (ledger.get(envId).isPresent()) {
                return false;
            }
            ledger.upsert(adopted);
            return true;
        });
        if (added) {
            log.warn("Adopted orphan container {} as {} owned by {} (ports {}, GPUs {})",
                    container.runtimeHandle(), adopted.status(), owner, adopted.hostPorts(), adopted.allocatedGpuIndices());
            metrics.recordReconcileRepair("orphan");
            publish(EnvironmentEvent.ORPHAN_ADOPTED, adopted, Map.of(
                    "container", container.runtimeHandle(),
                    "ownerFromLabel", !owner.equals(properties.getDefaultOwner())));
            result.adopted.add(envId);
        }
    }

    /**
     * For every port and GPU claimed by more than one active entry, keeps the entry whose
     * container actually binds it (the older one if both or neither do) and quarantines the
     * rest. Entries with a call in flight are never chosen.
     */
    private void resolveConflicts(Map<String, LiveContainer> byHandle, Map<String, LiveContainer> byName,
                                  Map<String, LiveContainer> byEnvLabel, PassResult result) {
        List<Environment> active = ledger.listAll().stream().filter(Environment::holdsResources).toList();
        var portHolders = new TreeMap<Integer, List<Environment>>();
        var gpuHolders = new TreeMap<Integer, List<Environment>>();
        for (Environment env : active) {
            env.hostPorts().forEach(p -> portHolders.computeIfAbsent(p, k -> new ArrayList<>()).add(env));
            env.allocatedGpuIndices().forEach(g -> gpuHolders.computeIfAbsent(g, k -> new ArrayList<>()).add(env));
        }

        var losers = new LinkedHashMap<String, Environment>();
        portHolders.forEach((port, holders) -> {
            if (holders.size() > 1) {
                pickLosers(holders, env -> bindsPort(match(env, byHandle, byName, byEnvLabel), port), "port " + port)
                        .forEach(e -> losers.putIfAbsent(e.id(), e));
            }
        });
        gpuHolders.forEach((gpu, holders) -> {
            if (holders.size() > 1) {
                pickLosers(holders, env -> bindsGpu(match(env, byHandle, byName, byEnvLabel), gpu), "GPU " + gpu)
                        .forEach(e -> losers.putIfAbsent(e.id(), e));
            }
        });

        for (Environment loser : losers.values()) {
            guarded(result, loser.id(), () -> {
                Environment quarantined = loser.quarantined(REASON_CONFLICT);
                if (replaceIfUnchanged(loser, quarantined)) {
                    log.warn("Quarantined {}: it claims ports {} / GPUs {} also held by another environment",
                            loser.id(), loser.hostPorts(), loser.allocatedGpuIndices());
                    metrics.recordReconcileRepair("conflict");
                    publish(EnvironmentEvent.CONFLICT_QUARANTINED, quarantined, Map.of());
                    result.conflicts.add(loser.id());
                }
            });
        }
    }

    private List<Environment> pickLosers(List<Environment> holders, Function<Environment, Boolean> bindsResource,
                                         String resource) {
        List<Environment> candidates = holders.stream().filter(e -> !inFlight.contains(e.id())).toList();
        if (candidates.size() < holders.size() - 1 || candidates.isEmpty()) {
            return List.of();
        }
        Comparator<Environment> keepFirst = Comparator
                .comparing((Environment e) -> !bindsResource.apply(e))
                .thenComparing(Environment::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Environment::id);
        Environment keeper = holders.stream()
                .filter(e -> inFlight.contains(e.id()))
                .findFirst()
                .orElseGet(() -> candidates.stream().sorted(keepFirst).findFirst().orElseThrow());
        log.warn("{} is held by {}; keeping {}", resource, holders.stream().map(Environment::id).toList(), keeper.id());
        return candidates.stream().filter(e -> !e.id().equals(keeper.id())).toList();
    }

    private void verifyIndexes(PassResult result) {
        IndexVerification verification = ledger.verifyIndexes();
        if (verification.consistent()) {
            return;
        }
        log.error("LedgerCorruption: stored indexes (ports {}, GPUs {}) differ from entries (ports {}, GPUs {}); rebuilding",
                verification.storedHostPorts(), verification.storedGpuIndices(),
                verification.expectedHostPorts(), verification.expectedGpuIndices());
        metrics.recordLedgerCorruption();
        metrics.recordReconcileRepair("index");
        eventBus.publish(new EnvironmentEvent(EnvironmentEvent.LEDGER_CORRUPTION, null, null, Map.of(
                "storedHostPorts", List.copyOf(verification.storedHostPorts()),
                "expectedHostPorts", List.copyOf(verification.expectedHostPorts()),
                "storedGpuIndices", List.copyOf(verification.storedGpuIndices()),
                "expectedGpuIndices", List.copyOf(verification.expectedGpuIndices())), clock.instant()));
        ledger.rebuildIndexes();
        result.indexRepaired = true;
    }

    /**
     * Writes {@code replacement} only if the entry still equals {@code expected}.
     */
    private boolean replaceIfUnchanged(Environment expected, Environment replacement) {
        return ledger.inWriteTransaction(() -> {
            Optional<Environment> current = ledger.get(expected.id());
            if (current.isEmpty() || !current.get().equals(expected) || inFlight.contains(expected.id())) {
                log.debug("Skipping repair of {}: changed since snapshot", expected.id());
                return false;
            }
            ledger.upsert(replacement);
            return true;
        });
    }

    private void guarded(PassResult result, String id, Runnable repair) {
        try {
            repair.run();
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} failed: {}", id, e.getMessage(), e);
            result.errors.put(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static LiveContainer match(Environment env, Map<String, LiveContainer> byHandle,
                                       Map<String, LiveContainer> byName, Map<String, LiveContainer> byEnvLabel) {
        LiveContainer container = env.runtimeHandle() != null ? byHandle.get(env.runtimeHandle()) : null;
        if (container == null) {
            container = byName.get(env.id());
        }
        if (container == null) {
            container = byEnvLabel.get(env.id());
        }
        return container;
    }

    private static boolean bindsPort(LiveContainer container, int port) {
        return container != null && container.isRunning()
                && container.portBindings().stream().anyMatch(p -> p.hostPort() == port);
    }

    private static boolean bindsGpu(LiveContainer container, int gpu) {
        return container != null && container.isRunning() && container.gpuIndices().contains(gpu);
    }

    private static Map<String, LiveContainer> index(List<LiveContainer> live, Function<LiveContainer, String> key) {
        var map = new HashMap<String, LiveContainer>();
        for (LiveContainer container : live) {
            String k = key.apply(container);
            if (k != null && !k.isEmpty()) {
                map.putIfAbsent(k, container);
            }
        }
        return map;
    }

    private void publish(String type, Environment env, Map<String, Object> payload) {
        eventBus.publish(new EnvironmentEvent(type, env.id(), env.ownerId(), payload, clock.instant()));
    }

    private static final class PassResult {
        final List<String> stale = new ArrayList<>();
        final List<String> adopted = new ArrayList<>();
        final List<String> drift = new ArrayList<>();
        final List<String> conflicts = new ArrayList<>();
        final List<String> quarantined = new ArrayList<>();
        final List<String> skippedInFlight = new ArrayList<>();
        final Map<String, String> errors = new LinkedHashMap<>();
        boolean indexRepaired;
    }
}
