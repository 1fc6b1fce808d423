package com.ailab.core.allocator;

import java.util.List;
import java.util.Set;

/**
 * Ports and GPU indices an environment gave back.
 */
public record ReleasedResources(String envId, List<Integer> hostPorts, Set<Integer> gpuIndices) {

    public boolean isEmpty() {
        return hostPorts.isEmpty() && gpuIndices.isEmpty();
    }
}
