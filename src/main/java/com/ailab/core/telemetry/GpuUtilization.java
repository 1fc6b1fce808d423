package com.ailab.core.telemetry;

/**
 * One GPU as reported by telemetry.
 */
public record GpuUtilization(int index, int utilizationPct, int memoryUsedMb, int memoryTotalMb) {

    public static GpuUtilization idle(int index) {
        return new GpuUtilization(index, 0, 0, 0);
    }
}
