package com.ailab.core.allocator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ailab.allocator")
public class AllocatorProperties {

    private int portRangeStart = 8800;
    private int portRangeEnd = 8999;
    /** A GPU at or above this utilization percentage is only handed to high-priority tiers. */
    private int gpuUtilizationThreshold = 50;

    public int getPortRangeStart() { return portRangeStart; }
    public void setPortRangeStart(int portRangeStart) { this.portRangeStart = portRangeStart; }
    public int getPortRangeEnd() { return portRangeEnd; }
    public void setPortRangeEnd(int portRangeEnd) { this.portRangeEnd = portRangeEnd; }
    public int getGpuUtilizationThreshold() { return gpuUtilizationThreshold; }
    public void setGpuUtilizationThreshold(int gpuUtilizationThreshold) { this.gpuUtilizationThreshold = gpuUtilizationThreshold; }
}
