package com.ailab.runtime;

import com.ailab.core.model.PortMapping;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A container as the runtime reports it right now.
 *
 * @param runtimeHandle container id
 * @param name          container name (leading slash stripped)
 * @param status        runtime status string
 * @param portBindings  published ports actually bound
 * @param gpuIndices    GPU devices actually requested
 * @param labels        labels attached at creation
 */
public record LiveContainer(
    String runtimeHandle,
    String name,
    String status,
    List<PortMapping> portBindings,
    Set<Integer> gpuIndices,
    Map<String, String> labels
) {

    public LiveContainer {
        portBindings = portBindings == null ? List.of() : List.copyOf(portBindings);
        gpuIndices = gpuIndices == null ? Set.of() : Set.copyOf(gpuIndices);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean isRunning() {
        return isRunningStatus(status);
    }

    public String label(String key) {
        return labels.get(key);
    }

    static boolean isRunningStatus(String status) {
        return "running".equalsIgnoreCase(status)
                || "restarting".equalsIgnoreCase(status)
                || "paused".equalsIgnoreCase(status);
    }
}
