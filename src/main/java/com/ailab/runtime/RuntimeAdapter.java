package com.ailab.runtime;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Boundary to the container runtime.
 * Implementations: {@link DockerRuntimeAdapter}.
 *
 * <p>Every call may fail with {@link RuntimeUnavailableException} (transient) or
 * {@link RuntimeRejectedException} (permanent).
 */
public interface RuntimeAdapter {

    /**
     * Creates (but does not start) a container.
     * @return the runtime handle (container id)
     */
    String create(ContainerSpec spec);

    void start(String handle);

    /**
     * Stops the container, killing it once {@code timeout} elapses.
     */
    void stop(String handle, Duration timeout);

    /**
     * Removes the container, stopping it first if needed.
     */
    void remove(String handle);

    /**
     * @throws ContainerNotFoundException if the runtime has no record of the container
     */
    ContainerState inspect(String handle);

    /**
     * Lists every container, running or not, whose name starts with {@code namePrefix} or that
     * carries the managed label. Always reflects live runtime state; never cached.
     */
    List<LiveContainer> listAll(String namePrefix);

    /**
     * Host ports currently published by any container on the runtime.
     */
    default Set<Integer> boundHostPorts() {
        return listAll("").stream()
                .filter(LiveContainer::isRunning)
                .flatMap(c -> c.portBindings().stream())
                .map(p -> p.hostPort())
                .collect(Collectors.toSet());
    }

    /**
     * Lightweight reachability check used by health reporting.
     */
    default boolean ping() {
        try {
            listAll("");
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
