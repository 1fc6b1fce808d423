package com.ailab.core.allocator;

import java.util.List;

/**
 * Free capacity at one point in time.
 */
public record Availability(
    int portRangeStart,
    int portRangeEnd,
    int freePorts,
    List<GpuSlot> gpus
) {

    public Availability {
        gpus = List.copyOf(gpus);
    }

    public long availableGpus() {
        return gpus.stream().filter(GpuSlot::available).count();
    }

    /**
     * @param allocated held by an environment in the ledger
     * @param available free and below the utilization threshold
     */
    public record GpuSlot(int index, int utilizationPct, boolean allocated, boolean available) {}
}
