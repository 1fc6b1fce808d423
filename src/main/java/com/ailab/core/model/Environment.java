package com.ailab.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A user's compute workspace: one container, its published ports and its GPU reservation.
 *
 * <p>Instances are immutable; every state change produces a new record that the
 * lifecycle manager or reconciler writes back to the ledger.
 *
 * @param id                   unique id, also the runtime container name
 * @param ownerId              owning user; never changes except through an admin claim of an adopted orphan
 * @param templateId           template catalog entry the environment was created from
 * @param status               lifecycle status
 * @param allocatedPorts       ordered (containerPort, hostPort) pairs
 * @param allocatedGpuIndices  GPU indices reserved for the environment
 * @param resourceLimits       CPU and memory limits
 * @param runtimeHandle        runtime container id once created (nullable)
 * @param failureReason        stable reason code when FAILED or ORPHANED (nullable)
 * @param createdAt            when the environment was requested
 * @param startedAt            when it last reached RUNNING (nullable)
 * @param stoppedAt            when it last reached STOPPED (nullable)
 */
public record Environment(
    String id,
    String ownerId,
    String templateId,
    EnvironmentStatus status,
    List<PortMapping> allocatedPorts,
    Set<Integer> allocatedGpuIndices,
    ResourceLimits resourceLimits,
    String runtimeHandle,
    String failureReason,
    Instant createdAt,
    Instant startedAt,
    Instant stoppedAt
) {

    public Environment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(status, "status");
        allocatedPorts = allocatedPorts == null ? List.of() : List.copyOf(allocatedPorts);
        SortedSet<Integer> gpus = allocatedGpuIndices == null ? new TreeSet<>() : new TreeSet<>(allocatedGpuIndices);
        allocatedGpuIndices = Collections.unmodifiableSortedSet(gpus);
    }

    /**
     * A freshly requested environment holding the given reservation.
     */
    public static Environment requested(String id, String ownerId, String templateId,
                                        List<PortMapping> ports, Set<Integer> gpus,
                                        ResourceLimits limits, Instant now) {
        return new Environment(id, ownerId, templateId, EnvironmentStatus.REQUESTED,
                ports, gpus, limits, null, null, now, null, null);
    }

    public List<Integer> hostPorts() {
        return allocatedPorts.stream().map(PortMapping::hostPort).toList();
    }

    public boolean holdsResources() {
        return status.isActive();
    }

    public int gpuCount() {
        return allocatedGpuIndices.size();
    }

    /**
     * Moves to {@code next}, enforcing the lifecycle state machine.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Environment transitionTo(EnvironmentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + next + " for " + id);
        }
        return withStatus(next);
    }

    /** Sets the status without state-machine checks. Reserved for reconciliation repairs. */
    public Environment withStatus(EnvironmentStatus next) {
        return new Environment(id, ownerId, templateId, next, allocatedPorts, allocatedGpuIndices,
                resourceLimits, runtimeHandle, failureReason, createdAt, startedAt, stoppedAt);
    }

    public Environment running(String handle, Instant at) {
        return new Environment(id, ownerId, templateId, EnvironmentStatus.RUNNING, allocatedPorts,
                allocatedGpuIndices, resourceLimits, handle, null, createdAt, at, stoppedAt);
    }

    public Environment stopped(Instant at) {
        return new Environment(id, ownerId, templateId, EnvironmentStatus.STOPPED, allocatedPorts,
                allocatedGpuIndices, resourceLimits, runtimeHandle, failureReason, createdAt, startedAt, at);
    }

    public Environment failed(String reason, Instant at) {
        return new Environment(id, ownerId, templateId, EnvironmentStatus.FAILED, allocatedPorts,
                allocatedGpuIndices, resourceLimits, runtimeHandle, reason, createdAt, startedAt, at);
    }

    public Environment quarantined(String reason) {
        return new Environment(id, ownerId, templateId, EnvironmentStatus.ORPHANED, allocatedPorts,
                allocatedGpuIndices, resourceLimits, runtimeHandle, reason, createdAt, startedAt, stoppedAt);
    }

    public Environment withRuntimeHandle(String handle) {
        return new Environment(id, ownerId, templateId, status, allocatedPorts, allocatedGpuIndices,
                resourceLimits, handle, failureReason, createdAt, startedAt, stoppedAt);
    }

    public Environment withOwner(String newOwnerId) {
        return new Environment(id, newOwnerId, templateId, status, allocatedPorts, allocatedGpuIndices,
                resourceLimits, runtimeHandle, failureReason, createdAt, startedAt, stoppedAt);
    }

    /** Replaces the bindings with what the runtime actually reports. */
    public Environment withBindings(List<PortMapping> ports, Set<Integer> gpus) {
        return new Environment(id, ownerId, templateId, status, ports, gpus,
                resourceLimits, runtimeHandle, failureReason, createdAt, startedAt, stoppedAt);
    }

    /** Handle to address the container by: the runtime id once known, the name before that. */
    public String runtimeRef() {
        return runtimeHandle != null ? runtimeHandle : id;
    }
}
