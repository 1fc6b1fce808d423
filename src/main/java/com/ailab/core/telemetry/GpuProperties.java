package com.ailab.core.telemetry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ailab.gpu")
public class GpuProperties {

    /** {@code nvidia-smi} or {@code static}. */
    private String telemetry = "nvidia-smi";
    private String nvidiaSmiPath = "nvidia-smi";
    private Duration queryTimeout = Duration.ofSeconds(10);
    /** GPU count reported by the static telemetry. */
    private int staticCount = 0;

    public String getTelemetry() { return telemetry; }
    public void setTelemetry(String telemetry) { this.telemetry = telemetry; }
    public String getNvidiaSmiPath() { return nvidiaSmiPath; }
    public void setNvidiaSmiPath(String nvidiaSmiPath) { this.nvidiaSmiPath = nvidiaSmiPath; }
    public Duration getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(Duration queryTimeout) { this.queryTimeout = queryTimeout; }
    public int getStaticCount() { return staticCount; }
    public void setStaticCount(int staticCount) { this.staticCount = staticCount; }
}
