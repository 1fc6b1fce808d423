package com.ailab.core.telemetry;

import java.util.List;

/**
 * Live GPU utilization of the host.
 */
public interface GpuTelemetry {

    /**
     * @return one entry per GPU on the host; empty if the host has none or telemetry is unavailable
     */
    List<GpuUtilization> utilization();
}
