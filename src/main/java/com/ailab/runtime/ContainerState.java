package com.ailab.runtime;

import java.time.Instant;

/**
 * Result of inspecting a single container.
 *
 * @param status    runtime status string ("running", "exited", "created", ...)
 * @param startedAt last start time reported by the runtime (nullable)
 */
public record ContainerState(String status, Instant startedAt) {

    public boolean isRunning() {
        return LiveContainer.isRunningStatus(status);
    }
}
