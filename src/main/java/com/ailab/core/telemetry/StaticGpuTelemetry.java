package com.ailab.core.telemetry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed set of GPUs, all idle unless told otherwise. For hosts without {@code nvidia-smi}
 * and for tests.
 */
public class StaticGpuTelemetry implements GpuTelemetry {

    private final Map<Integer, GpuUtilization> gpus = new ConcurrentHashMap<>();

    public StaticGpuTelemetry(int count) {
        for (int i = 0; i < count; i++) {
            gpus.put(i, GpuUtilization.idle(i));
        }
    }

    public StaticGpuTelemetry(List<GpuUtilization> initial) {
        initial.forEach(g -> gpus.put(g.index(), g));
    }

    public void setUtilization(int index, int utilizationPct) {
        gpus.compute(index, (i, current) -> current == null
                ? new GpuUtilization(i, utilizationPct, 0, 0)
                : new GpuUtilization(i, utilizationPct, current.memoryUsedMb(), current.memoryTotalMb()));
    }

    @Override
    public List<GpuUtilization> utilization() {
        var list = new ArrayList<>(gpus.values());
        list.sort(Comparator.comparingInt(GpuUtilization::index));
        return list;
    }
}
