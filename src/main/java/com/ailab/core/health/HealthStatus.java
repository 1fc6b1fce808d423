package com.ailab.core.health;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Result of checking one component of the manager.
 *
 * @param component ledger, runtime, reconciler or gpus
 * @param status    severity, ordered from best to worst
 * @param detail    one line for operators
 * @param metadata  extra key/value facts shown by {@code ailab health} and the health endpoint
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** Declared from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /** The worst status among {@code checks}; UP when there are none. */
    public static Status worst(List<HealthStatus> checks) {
        return checks.stream()
                .map(HealthStatus::status)
                .max(Comparator.naturalOrder())
                .orElse(Status.UP);
    }
}
