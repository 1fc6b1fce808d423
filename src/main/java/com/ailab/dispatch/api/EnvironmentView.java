package com.ailab.dispatch.api;

import com.ailab.core.model.Environment;
import com.ailab.core.model.PortMapping;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * What the UI layer sees of an environment. The runtime handle stays internal.
 */
public record EnvironmentView(
    String id,
    String ownerId,
    String templateId,
    String status,
    List<PortMapping> ports,
    Set<Integer> gpus,
    Double cpuCores,
    Integer memoryMb,
    String accessUrl,
    String failureReason,
    Instant createdAt,
    Instant startedAt,
    Instant stoppedAt
) {

    public static EnvironmentView of(Environment env, String publicHost) {
        String accessUrl = env.allocatedPorts().isEmpty() || !env.holdsResources()
                ? null
                : "http://" + publicHost + ":" + env.allocatedPorts().get(0).hostPort();
        return new EnvironmentView(
                env.id(),
                env.ownerId(),
                env.templateId(),
                env.status().name().toLowerCase(),
                env.allocatedPorts(),
                env.allocatedGpuIndices(),
                env.resourceLimits() != null ? env.resourceLimits().cpuCores() : null,
                env.resourceLimits() != null ? env.resourceLimits().memoryMb() : null,
                accessUrl,
                env.failureReason(),
                env.createdAt(),
                env.startedAt(),
                env.stoppedAt());
    }
}
