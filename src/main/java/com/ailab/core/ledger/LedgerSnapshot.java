package com.ailab.core.ledger;

import com.ailab.core.model.Environment;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time copy of the ledger. Safe to diff while writers continue.
 */
public record LedgerSnapshot(
    Map<String, Environment> environments,
    Set<Integer> allocatedHostPorts,
    Set<Integer> allocatedGpuIndices,
    Set<String> quarantinedIds,
    Instant takenAt
) {

    public LedgerSnapshot {
        environments = Map.copyOf(environments);
        allocatedHostPorts = Set.copyOf(allocatedHostPorts);
        allocatedGpuIndices = Set.copyOf(allocatedGpuIndices);
        quarantinedIds = Set.copyOf(quarantinedIds);
    }

    public Optional<Environment> get(String envId) {
        return Optional.ofNullable(environments.get(envId));
    }
}
