package com.ailab.core.lifecycle;

import com.ailab.core.allocator.ResourceAllocator;
import com.ailab.core.error.AccessDeniedException;
import com.ailab.core.error.EnvironmentException;
import com.ailab.core.error.EnvironmentNotFoundException;
import com.ailab.core.error.InvalidStateException;
import com.ailab.core.error.LedgerCorruptionException;
import com.ailab.core.events.EnvironmentEvent;
import com.ailab.core.events.EventBus;
import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.logging.MdcContext;
import com.ailab.core.metrics.ErmMetrics;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import com.ailab.core.model.EnvironmentStatus;
import com.ailab.core.model.PortMapping;
import com.ailab.core.model.ResourceLimits;
import com.ailab.core.model.User;
import com.ailab.core.quota.QuotaDecision;
import com.ailab.core.quota.QuotaEngine;
import com.ailab.core.reconcile.ReconcilerProperties;
import com.ailab.core.template.EnvironmentTemplate;
import com.ailab.core.template.TemplateCatalog;
import com.ailab.core.telemetry.GpuTelemetry;
import com.ailab.core.telemetry.GpuUtilization;
import com.ailab.runtime.ContainerLabels;
import com.ailab.runtime.ContainerNotFoundException;
import com.ailab.runtime.ContainerSpec;
import com.ailab.runtime.RuntimeAdapter;
import com.ailab.runtime.RuntimeCallExecutor;
import com.ailab.runtime.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Drives environments through their lifecycle:
 * {@code REQUESTED -> CREATING -> RUNNING -> STOPPING -> STOPPED}, with {@code FAILED}
 * reachable from the in-flight states.
 *
 * <p>Each operation follows the same shape: decide and reserve inside one ledger write
 * transaction, call the runtime outside the lock while the entry sits in an in-flight
 * status, then commit the outcome in a second write transaction. Every failure path
 * commits {@code FAILED} and frees the reservation in the same write, so nothing leaks
 * and the reconciler can always repair what a crash leaves behind.
 */
@Service
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private final AllocationLedger ledger;
    private final QuotaEngine quotaEngine;
    private final ResourceAllocator allocator;
    private final RuntimeAdapter runtime;
    private final RuntimeCallExecutor runtimeCalls;
    private final TemplateCatalog templates;
    private final GpuTelemetry gpuTelemetry;
    private final InFlightRegistry inFlight;
    private final EventBus eventBus;
    private final ErmMetrics metrics;
    private final RuntimeProperties runtimeProperties;
    private final ReconcilerProperties reconcilerProperties;
    private final Clock clock;

    public LifecycleManager(AllocationLedger ledger,
                            QuotaEngine quotaEngine,
                            ResourceAllocator allocator,
                            RuntimeAdapter runtime,
                            RuntimeCallExecutor runtimeCalls,
                            TemplateCatalog templates,
                            GpuTelemetry gpuTelemetry,
                            InFlightRegistry inFlight,
                            EventBus eventBus,
                            ErmMetrics metrics,
                            RuntimeProperties runtimeProperties,
                            ReconcilerProperties reconcilerProperties,
                            Clock clock) {
        this.ledger = ledger;
        this.quotaEngine = quotaEngine;
        this.allocator = allocator;
        this.runtime = runtime;
        this.runtimeCalls = runtimeCalls;
        this.templates = templates;
        this.gpuTelemetry = gpuTelemetry;
        this.inFlight = inFlight;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.runtimeProperties = runtimeProperties;
        this.reconcilerProperties = reconcilerProperties;
        this.clock = clock;
    }

    public Environment create(String userId, String templateId, int requestedGpus) {
        return create(userId, CreateEnvironmentRequest.of(templateId, requestedGpus));
    }

    /**
     * Creates and starts a new environment for {@code userId}.
     *
     * @return the environment in {@code RUNNING}
     * @throws com.ailab.core.error.QuotaExceededException           if the user's tier does not allow it
     * @throws com.ailab.core.error.PortsExhaustedException          if the host port range is saturated
     * @throws com.ailab.core.error.InsufficientGpuCapacityException if not enough GPUs qualify
     * @throws EnvironmentException                                  for runtime failures; the environment is then {@code FAILED}
     */
    public Environment create(String userId, CreateEnvironmentRequest request) {
        EnvironmentTemplate template = templates.get(request.templateId());
        int gpus = request.gpus() != null ? request.gpus() : template.defaultGpus();
        if (gpus < 0) {
            throw new IllegalArgumentException("GPU count must not be negative: " + gpus);
        }
        var limits = new ResourceLimits(
                request.cpuCores() != null ? request.cpuCores() : template.defaultCpu(),
                request.memoryMb() != null ? request.memoryMb() : template.defaultMemoryMb());
        String envId = newEnvironmentId(template.id());
        MdcContext.setEnvironment(envId, userId);
        try {
            // Slow lookups stay outside the write lock
            Set<Integer> boundPorts = timed("list", envId, runtime::boundHostPorts);
            List<GpuUtilization> utilization = gpus > 0 ? gpuTelemetry.utilization() : List.of();

            Environment creating;
            try {
                creating = ledger.inWriteTransaction(() -> {
                    QuotaDecision decision = checkQuota(userId, gpus, limits.memoryMb(), envId);
                    List<PortMapping> ports = allocator.reservePorts(template.containerPorts(), boundPorts);
                    Set<Integer> gpuIndices = allocator.reserveGpus(gpus, decision.usage().policy().highPriority(), utilization);
                    Environment env = Environment.requested(envId, userId, template.id(), ports, gpuIndices, limits, clock.instant())
                            .transitionTo(EnvironmentStatus.CREATING);
                    ledger.upsert(env);
                    inFlight.begin(envId);
                    return env;
                });
            } catch (EnvironmentException e) {
                metrics.recordAllocation(e.reason());
                throw e;
            }
            log.info("Environment {} reserved ports {} and GPUs {}", envId, creating.allocatedPorts(), creating.allocatedGpuIndices());
            publish(EnvironmentEvent.CREATED, creating, Map.of(
                    "template", template.id(),
                    "ports", creating.hostPorts(),
                    "gpus", List.copyOf(creating.allocatedGpuIndices())));

            var handle = new AtomicReference<String>();
            try {
                handle.set(timed("create", envId, () -> runtime.create(containerSpec(creating, template, request.envVars()))));
                timed("start", envId, () -> {
                    runtime.start(handle.get());
                    return null;
                });
                Environment running = commitRunning(envId, handle.get());
                if (running == null) {
                    throw new InvalidStateException("Environment " + envId + " was removed while it was being created");
                }
                ledger.recordUser(new User(userId, quotaEngine.tierOf(userId), clock.instant()));
                metrics.recordAllocation("success");
                publish(EnvironmentEvent.RUNNING, running, Map.of());
                log.info("Environment {} running for {}", envId, userId);
                return running;
            } catch (RuntimeException e) {
                removeQuietly(handle.get() != null ? handle.get() : envId);
                fail(envId, EnvironmentStatus.CREATING, e);
                metrics.recordAllocation(reasonOf(e));
                throw e;
            } finally {
                inFlight.end(envId);
            }
        } finally {
            MdcContext.clearEnvironment();
        }
    }

    /**
     * Restarts a stopped environment on the ports and GPUs it held before.
     */
    public Environment start(String envId, Caller caller) {
        Environment env = authorize(envId, caller, "start");
        MdcContext.setEnvironment(envId, env.ownerId());
        try {
            Set<Integer> boundPorts = timed("list", envId, runtime::boundHostPorts);
            List<GpuUtilization> utilization = env.gpuCount() > 0 ? gpuTelemetry.utilization() : List.of();

            Environment creating = ledger.inWriteTransaction(() -> {
                Environment current = require(envId);
                if (current.status() != EnvironmentStatus.STOPPED) {
                    throw new InvalidStateException(envId, current.status(), "start");
                }
                int memory = current.resourceLimits() != null ? current.resourceLimits().memoryMb() : 0;
                QuotaDecision decision = checkQuota(current.ownerId(), current.gpuCount(), memory, envId);
                allocator.reacquire(current, decision.usage().policy().highPriority(), boundPorts, utilization);
                Environment next = current.transitionTo(EnvironmentStatus.CREATING);
                ledger.upsert(next);
                inFlight.begin(envId);
                return next;
            });

            try {
                String handle = creating.runtimeRef();
                timed("start", envId, () -> {
                    runtime.start(handle);
                    return null;
                });
                Environment running = commitRunning(envId, handle);
                if (running == null) {
                    throw new InvalidStateException("Environment " + envId + " was removed while it was being started");
                }
                publish(EnvironmentEvent.RUNNING, running, Map.of("restarted", true));
                log.info("Environment {} restarted by {}", envId, caller.userId());
                return running;
            } catch (RuntimeException e) {
                fail(envId, EnvironmentStatus.CREATING, e);
                throw e;
            } finally {
                inFlight.end(envId);
            }
        } finally {
            MdcContext.clearEnvironment();
        }
    }

    /**
     * Stops a running environment and frees its ports and GPUs once the runtime confirms.
     *
     * @throws AccessDeniedException unless the caller owns the environment or is an admin
     */
    public Environment stop(String envId, Caller caller) {
        Environment env = authorize(envId, caller, "stop");
        MdcContext.setEnvironment(envId, env.ownerId());
        try {
            Environment stopping = ledger.inWriteTransaction(() -> {
                Environment current = require(envId);
                if (current.status() != EnvironmentStatus.RUNNING) {
                    throw new InvalidStateException(envId, current.status(), "stop");
                }
                Environment next = current.transitionTo(EnvironmentStatus.STOPPING);
                ledger.upsert(next);
                inFlight.begin(envId);
                return next;
            });

            try {
                try {
                    timed("stop", envId, () -> {
                        runtime.stop(stopping.runtimeRef(), runtimeProperties.getStopTimeout());
                        return null;
                    });
                } catch (ContainerNotFoundException e) {
                    log.warn("Container of {} is already gone, treating it as stopped", envId);
                }
                Environment stopped = ledger.inWriteTransaction(() -> {
                    Environment current = ledger.get(envId).orElse(null);
                    if (current == null || current.status() != EnvironmentStatus.STOPPING) {
                        return current;
                    }
                    allocator.release(current);
                    Environment next = current.stopped(clock.instant());
                    ledger.upsert(next);
                    return next;
                });
                if (stopped == null) {
                    throw new EnvironmentNotFoundException(envId);
                }
                publish(EnvironmentEvent.STOPPED, stopped, Map.of("by", caller.userId()));
                log.info("Environment {} stopped by {}", envId, caller.userId());
                return stopped;
            } catch (RuntimeException e) {
                fail(envId, EnvironmentStatus.STOPPING, e);
                throw e;
            } finally {
                inFlight.end(envId);
            }
        } finally {
            MdcContext.clearEnvironment();
        }
    }

    /**
     * Removes the container and then the ledger entry. If the runtime refuses, the ledger
     * is left untouched.
     */
    public void destroy(String envId, Caller caller) {
        Environment env = authorize(envId, caller, "destroy");
        MdcContext.setEnvironment(envId, env.ownerId());
        try {
            try {
                timed("remove", envId, () -> {
                    runtime.remove(env.runtimeRef());
                    return null;
                });
            } catch (ContainerNotFoundException e) {
                log.debug("No container for {}, removing ledger entry only", envId);
            }
            ledger.inWriteTransaction(() -> ledger.get(envId).ifPresent(current -> {
                if (current.holdsResources()) {
                    allocator.release(current);
                }
                ledger.remove(envId);
            }));
            publish(EnvironmentEvent.DESTROYED, env, Map.of("by", caller.userId()));
            log.info("Environment {} destroyed by {}", envId, caller.userId());
        } finally {
            MdcContext.clearEnvironment();
        }
    }

    public Environment get(String envId, Caller caller) {
        return authorize(envId, caller, "get");
    }

    /**
     * The owner-filtered view. Never includes another user's environments.
     */
    public List<Environment> listForUser(String userId) {
        return ledger.listByOwner(userId);
    }

    /**
     * Every environment in the ledger.
     *
     * @throws AccessDeniedException unless the caller is an admin
     */
    public List<Environment> listAll(Caller caller) {
        requireAdmin(caller, "list_all");
        return ledger.listAll();
    }

    /**
     * @throws AccessDeniedException unless the caller is an admin; the denial is logged,
     *         counted and published like any other
     */
    public void requireAdmin(Caller caller, String operation) {
        if (!caller.admin()) {
            throw denied(caller, null, null, operation);
        }
    }

    /**
     * Hands an adopted environment to a real user. Only environments still held by the
     * reconciler's default owner can be claimed, and the new owner's quota must allow it.
     */
    public Environment claim(String envId, String newOwnerId, Caller caller) {
        requireAdmin(caller, "claim");
        if (newOwnerId == null || newOwnerId.isBlank()) {
            throw new IllegalArgumentException("New owner must not be blank");
        }
        Environment claimed = ledger.inWriteTransaction(() -> {
            Environment current = require(envId);
            if (!reconcilerProperties.getDefaultOwner().equals(current.ownerId())) {
                throw new InvalidStateException("Environment " + envId + " is owned by " + current.ownerId()
                        + " and cannot be claimed");
            }
            if (current.holdsResources()) {
                int memory = current.resourceLimits() != null ? current.resourceLimits().memoryMb() : 0;
                checkQuota(newOwnerId, current.gpuCount(), memory, envId);
            }
            Environment next = current.withOwner(newOwnerId);
            ledger.upsert(next);
            return next;
        });
        publish(EnvironmentEvent.CLAIMED, claimed, Map.of("by", caller.userId()));
        log.info("Environment {} claimed for {} by {}", envId, newOwnerId, caller.userId());
        return claimed;
    }

    private QuotaDecision checkQuota(String userId, int gpus, int memoryMb, String envId) {
        QuotaDecision decision = quotaEngine.canAllocate(userId, gpus, memoryMb);
        if (!decision.allowed()) {
            metrics.recordQuotaDenial(decision.reason().code());
            eventBus.publish(new EnvironmentEvent(EnvironmentEvent.QUOTA_DENIED, envId, userId,
                    Map.of("reason", decision.reason().code()), clock.instant()));
            decision.orThrow();
        }
        return decision;
    }

    /**
     * Writes {@code RUNNING} if the entry is still {@code CREATING}.
     *
     * @return the committed entry, or null if it was removed or changed concurrently
     */
    private Environment commitRunning(String envId, String handle) {
        return ledger.inWriteTransaction(() -> {
            Environment current = ledger.get(envId).orElse(null);
            if (current == null || !current.status().canTransitionTo(EnvironmentStatus.RUNNING)) {
                return null;
            }
            Environment next = current.running(handle, clock.instant());
            ledger.upsert(next);
            return next;
        });
    }

    /**
     * Commits {@code FAILED} and frees the reservation in one write, provided the entry is
     * still in the status the failed operation left it in.
     */
    private void fail(String envId, EnvironmentStatus expected, RuntimeException cause) {
        String reason = reasonOf(cause);
        try {
            Environment failed = ledger.inWriteTransaction(() -> {
                Environment current = ledger.get(envId).orElse(null);
                if (current == null || current.status() != expected) {
                    return null;
                }
                allocator.release(current);
                Environment next = current.failed(reason, clock.instant());
                ledger.upsert(next);
                return next;
            });
            if (failed != null) {
                log.warn("Environment {} failed ({}): {}", envId, reason, cause.getMessage());
                publish(EnvironmentEvent.FAILED, failed, Map.of("reason", reason));
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of {}; the reconciler will repair it: {}", envId, e.getMessage(), e);
        }
    }

    private Environment authorize(String envId, Caller caller, String operation) {
        Environment env = require(envId);
        if (!caller.mayAccess(env)) {
            throw denied(caller, envId, env.ownerId(), operation);
        }
        return env;
    }

    private AccessDeniedException denied(Caller caller, String envId, String ownerId, String operation) {
        log.warn("Access denied: {} attempted {} on {}", caller.userId(), operation, envId != null ? envId : "all environments");
        metrics.recordAccessDenied(operation);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("caller", caller.userId());
        payload.put("operation", operation);
        eventBus.publish(new EnvironmentEvent(EnvironmentEvent.ACCESS_DENIED, envId, ownerId, payload, clock.instant()));
        return new AccessDeniedException(caller.userId() + " may not " + operation
                + (envId != null ? " environment " + envId : " all environments"));
    }

    private Environment require(String envId) {
        return ledger.get(envId).orElseThrow(() -> ledger.quarantined().containsKey(envId)
                ? new LedgerCorruptionException("Ledger entry for " + envId + " is quarantined as unreadable")
                : new EnvironmentNotFoundException(envId));
    }

    private ContainerSpec containerSpec(Environment env, EnvironmentTemplate template, Map<String, String> extraEnv) {
        var envVars = new LinkedHashMap<String, String>(extraEnv);
        envVars.put("AI_LAB_ENV_ID", env.id());
        envVars.put("AI_LAB_OWNER", env.ownerId());
        return new ContainerSpec(
                env.id(),
                template.image(),
                envVars,
                env.allocatedPorts(),
                env.allocatedGpuIndices(),
                env.resourceLimits().cpuCores(),
                env.resourceLimits().memoryMb(),
                ContainerLabels.of(env.id(), env.ownerId(), env.templateId(), env.allocatedGpuIndices()));
    }

    private <T> T timed(String operation, String envId, Supplier<T> action) {
        long start = System.currentTimeMillis();
        boolean success = false;
        try {
            T result = runtimeCalls.call(operation, envId, action);
            success = true;
            return result;
        } finally {
            metrics.recordRuntimeCall(operation, System.currentTimeMillis() - start, success);
        }
    }

    private void removeQuietly(String handle) {
        try {
            runtime.remove(handle);
        } catch (ContainerNotFoundException e) {
            log.debug("Nothing to clean up for {}", handle);
        } catch (RuntimeException e) {
            log.warn("Cleanup of container {} failed, leaving it to the reconciler: {}", handle, e.getMessage());
        }
    }

    private String newEnvironmentId(String templateId) {
        return runtimeProperties.getNamePrefix() + templateId + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String reasonOf(RuntimeException e) {
        return e instanceof EnvironmentException ee ? ee.reason() : "internal_error";
    }

    private void publish(String type, Environment env, Map<String, Object> payload) {
        eventBus.publish(new EnvironmentEvent(type, env.id(), env.ownerId(), payload, clock.instant()));
    }
}
