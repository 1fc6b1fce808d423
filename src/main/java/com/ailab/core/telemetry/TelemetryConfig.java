package com.ailab.core.telemetry;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TelemetryConfig {

    @Bean
    public GpuTelemetry gpuTelemetry(GpuProperties properties) {
        String mode = properties.getTelemetry() == null ? "nvidia-smi" : properties.getTelemetry().toLowerCase();
        return switch (mode) {
            case "static" -> new StaticGpuTelemetry(properties.getStaticCount());
            case "nvidia-smi" -> new NvidiaSmiGpuTelemetry(properties.getNvidiaSmiPath(), properties.getQueryTimeout());
            default -> throw new IllegalStateException("Unknown GPU telemetry '" + properties.getTelemetry()
                    + "'. Supported: nvidia-smi, static");
        };
    }
}
