package com.ailab.core.lifecycle;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * A request for a new environment. Unset fields fall back to the template's defaults.
 *
 * @param templateId template catalog key
 * @param gpus       GPUs to reserve (nullable)
 * @param cpuCores   CPU limit (nullable)
 * @param memoryMb   memory limit (nullable)
 * @param envVars    extra container environment variables (nullable)
 */
public record CreateEnvironmentRequest(
    @NotBlank String templateId,
    @Min(0) Integer gpus,
    @Positive Double cpuCores,
    @Positive Integer memoryMb,
    Map<String, String> envVars
) {

    public CreateEnvironmentRequest {
        envVars = envVars == null ? Map.of() : Map.copyOf(envVars);
    }

    public static CreateEnvironmentRequest of(String templateId, int gpus) {
        return new CreateEnvironmentRequest(templateId, gpus, null, null, Map.of());
    }
}
