package com.ailab.core.ledger;

import com.ailab.core.model.Environment;
import com.ailab.core.model.User;

import java.util.List;
import java.util.Map;

/**
 * Persisted form of the ledger.
 *
 * @param version             schema version
 * @param environments        environment id to record
 * @param allocatedHostPorts  host ports reserved by non-terminal environments, as last written
 * @param allocatedGpuIndices GPU indices reserved by non-terminal environments, as last written
 * @param users               users seen so far
 * @param quarantine          entries that could not be read back, kept verbatim for an operator
 */
public record LedgerDocument(
    int version,
    Map<String, Environment> environments,
    List<Integer> allocatedHostPorts,
    List<Integer> allocatedGpuIndices,
    Map<String, User> users,
    Map<String, String> quarantine
) {

    public static final int CURRENT_VERSION = 1;

    public LedgerDocument {
        environments = environments == null ? Map.of() : Map.copyOf(environments);
        allocatedHostPorts = allocatedHostPorts == null ? List.of() : List.copyOf(allocatedHostPorts);
        allocatedGpuIndices = allocatedGpuIndices == null ? List.of() : List.copyOf(allocatedGpuIndices);
        users = users == null ? Map.of() : Map.copyOf(users);
        quarantine = quarantine == null ? Map.of() : Map.copyOf(quarantine);
    }

    public static LedgerDocument empty() {
        return new LedgerDocument(CURRENT_VERSION, Map.of(), List.of(), List.of(), Map.of(), Map.of());
    }
}
