package com.ailab.core.template;

import java.util.List;

/**
 * Blueprint an environment is created from.
 *
 * @param id              catalog key, e.g. {@code pytorch-jupyter}
 * @param name            display name
 * @param image           container image
 * @param containerPorts  ports the image listens on; each gets one published host port
 * @param defaultCpu      CPU cores when the request does not override them
 * @param defaultMemoryMb memory when the request does not override it
 * @param defaultGpus     GPUs when the request does not override them
 */
public record EnvironmentTemplate(
    String id,
    String name,
    String image,
    List<Integer> containerPorts,
    double defaultCpu,
    int defaultMemoryMb,
    int defaultGpus
) {

    public EnvironmentTemplate {
        containerPorts = containerPorts == null ? List.of() : List.copyOf(containerPorts);
    }
}
