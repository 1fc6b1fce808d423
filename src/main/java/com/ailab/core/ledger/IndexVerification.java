package com.ailab.core.ledger;

import java.util.Set;

/**
 * Result of comparing the ledger's stored allocation indexes with the ones recomputed
 * from its environment records.
 */
public record IndexVerification(
    Set<Integer> storedHostPorts,
    Set<Integer> expectedHostPorts,
    Set<Integer> storedGpuIndices,
    Set<Integer> expectedGpuIndices
) {

    public boolean consistent() {
        return storedHostPorts.equals(expectedHostPorts) && storedGpuIndices.equals(expectedGpuIndices);
    }
}
