package com.ailab.core.model;

/**
 * CPU and memory limits applied to an environment's container.
 */
public record ResourceLimits(double cpuCores, int memoryMb) {

    public ResourceLimits {
        if (cpuCores < 0) {
            throw new IllegalArgumentException("cpuCores must be >= 0: " + cpuCores);
        }
        if (memoryMb < 0) {
            throw new IllegalArgumentException("memoryMb must be >= 0: " + memoryMb);
        }
    }
}
