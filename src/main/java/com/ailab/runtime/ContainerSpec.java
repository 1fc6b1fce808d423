package com.ailab.runtime;

import com.ailab.core.model.PortMapping;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything needed to create an environment container.
 *
 * @param name          container name, equal to the environment id
 * @param image         image reference from the template
 * @param envVars       environment variables to inject
 * @param portBindings  container to host port mappings to publish
 * @param gpuIndices    GPU device indices to expose
 * @param cpuCores      CPU limit in cores
 * @param memoryMb      memory limit in MB
 * @param labels        structured metadata (owner, template) stored with the container
 */
public record ContainerSpec(
    String name,
    String image,
    Map<String, String> envVars,
    List<PortMapping> portBindings,
    Set<Integer> gpuIndices,
    double cpuCores,
    int memoryMb,
    Map<String, String> labels
) {}
