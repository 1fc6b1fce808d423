package com.ailab.runtime;

import com.ailab.core.model.PortMapping;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.BadRequestException;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Supplier;

/**
 * Docker-based {@link RuntimeAdapter}.
 *
 * <p>Each environment container is configured with:
 * <ul>
 *   <li>The environment id as container name</li>
 *   <li>Labels recording owner, template and GPU indices ({@link ContainerLabels})</li>
 *   <li>Published host ports from the allocator</li>
 *   <li>An NVIDIA device request for exactly the allocated GPU indices</li>
 *   <li>Memory and CPU limits from the template</li>
 * </ul>
 *
 * <p>docker-java exceptions are translated: 404 to {@link ContainerNotFoundException},
 * 400/409 to {@link RuntimeRejectedException}, everything else (5xx, socket and transport
 * errors) to {@link RuntimeUnavailableException}.
 */
public class DockerRuntimeAdapter implements RuntimeAdapter {

    private static final Logger log = LoggerFactory.getLogger(DockerRuntimeAdapter.class);

    private final DockerClient dockerClient;
    private final String gpuDriver;

    public DockerRuntimeAdapter(DockerClient dockerClient, String gpuDriver) {
        this.dockerClient = dockerClient;
        this.gpuDriver = gpuDriver != null ? gpuDriver : "nvidia";
    }

    @Override
    public String create(ContainerSpec spec) {
        var ports = new Ports();
        var exposed = new ArrayList<ExposedPort>();
        for (PortMapping mapping : spec.portBindings()) {
            ExposedPort port = ExposedPort.tcp(mapping.containerPort());
            exposed.add(port);
            ports.bind(port, Ports.Binding.bindPort(mapping.hostPort()));
        }

        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(ports)
                .withMemory((long) spec.memoryMb() * 1024 * 1024)
                .withNanoCPUs((long) (spec.cpuCores() * 1_000_000_000L))
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart());

        if (!spec.gpuIndices().isEmpty()) {
            var deviceIds = new TreeSet<>(spec.gpuIndices()).stream().map(String::valueOf).toList();
            hostConfig.withDeviceRequests(List.of(new DeviceRequest()
                    .withDriver(gpuDriver)
                    .withDeviceIds(deviceIds)
                    .withCapabilities(List.of(List.of("gpu")))));
        }

        var envList = new ArrayList<String>();
        spec.envVars().forEach((k, v) -> envList.add(k + "=" + v));

        log.info("Creating container {} (image: {}, ports: {}, gpus: {})",
                spec.name(), spec.image(), spec.portBindings(), spec.gpuIndices());

        var response = call("create", spec.name(), () -> dockerClient.createContainerCmd(spec.image())
                .withName(spec.name())
                .withLabels(spec.labels())
                .withEnv(envList)
                .withExposedPorts(exposed)
                .withHostConfig(hostConfig)
                .exec());
        return response.getId();
    }

    @Override
    public void start(String handle) {
        call("start", handle, () -> {
            try {
                dockerClient.startContainerCmd(handle).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already running", handle);
            }
            return null;
        });
        log.info("Container {} started", handle);
    }

    @Override
    public void stop(String handle, Duration timeout) {
        call("stop", handle, () -> {
            try {
                dockerClient.stopContainerCmd(handle).withTimeout((int) timeout.toSeconds()).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already stopped", handle);
            }
            return null;
        });
        log.info("Container {} stopped", handle);
    }

    @Override
    public void remove(String handle) {
        call("remove", handle, () -> {
            dockerClient.removeContainerCmd(handle).withForce(true).exec();
            return null;
        });
        log.info("Container {} removed", handle);
    }

    @Override
    public ContainerState inspect(String handle) {
        var response = call("inspect", handle, () -> dockerClient.inspectContainerCmd(handle).exec());
        var state = response.getState();
        if (state == null) {
            return new ContainerState("unknown", null);
        }
        return new ContainerState(state.getStatus(), parseInstant(state.getStartedAt()));
    }

    @Override
    public List<LiveContainer> listAll(String namePrefix) {
        String prefix = namePrefix == null ? "" : namePrefix;
        List<Container> containers = call("list", prefix,
                () -> dockerClient.listContainersCmd().withShowAll(true).exec());

        var result = new ArrayList<LiveContainer>();
        for (Container container : containers) {
            String name = primaryName(container);
            Map<String, String> labels = container.getLabels() != null ? container.getLabels() : Map.of();
            if (!name.startsWith(prefix) && !ContainerLabels.isManaged(labels)) {
                continue;
            }
            result.add(new LiveContainer(
                    container.getId(),
                    name,
                    container.getState(),
                    publishedPorts(container),
                    gpuIndices(container.getId(), labels),
                    labels));
        }
        return result;
    }

    @Override
    public Set<Integer> boundHostPorts() {
        List<Container> running = call("list", "*", () -> dockerClient.listContainersCmd().exec());
        var bound = new TreeSet<Integer>();
        for (Container container : running) {
            for (PortMapping mapping : publishedPorts(container)) {
                bound.add(mapping.hostPort());
            }
        }
        return bound;
    }

    @Override
    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.warn("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * GPU indices come from the container's device request; the label is the fallback for
     * containers created with {@code --gpus all} or by an older release.
     */
    private Set<Integer> gpuIndices(String containerId, Map<String, String> labels) {
        try {
            InspectContainerResponse inspected = dockerClient.inspectContainerCmd(containerId).exec();
            var hostConfig = inspected.getHostConfig();
            if (hostConfig != null && hostConfig.getDeviceRequests() != null) {
                var indices = new TreeSet<Integer>();
                for (DeviceRequest request : hostConfig.getDeviceRequests()) {
                    if (request.getDeviceIds() == null) continue;
                    for (String id : request.getDeviceIds()) {
                        try {
                            indices.add(Integer.parseInt(id.trim()));
                        } catch (NumberFormatException e) {
                            log.debug("Ignoring non-index device id {} on {}", id, containerId);
                        }
                    }
                }
                if (!indices.isEmpty()) {
                    return indices;
                }
            }
        } catch (NotFoundException e) {
            log.debug("Container {} disappeared while listing", containerId);
        } catch (RuntimeException e) {
            log.warn("Could not inspect device requests of {}, using label: {}", containerId, e.getMessage());
        }
        return ContainerLabels.parseGpus(labels.get(ContainerLabels.GPUS));
    }

    static List<PortMapping> publishedPorts(Container container) {
        var mappings = new ArrayList<PortMapping>();
        if (container.getPorts() == null) {
            return mappings;
        }
        var seen = new HashSet<Integer>();
        for (ContainerPort port : container.getPorts()) {
            // IPv4 and IPv6 bindings are reported separately for the same host port
            if (port.getPublicPort() != null && port.getPrivatePort() != null && seen.add(port.getPublicPort())) {
                mappings.add(new PortMapping(port.getPrivatePort(), port.getPublicPort()));
            }
        }
        mappings.sort(Comparator.comparingInt(PortMapping::hostPort));
        return mappings;
    }

    static String primaryName(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return "";
        }
        String name = names[0];
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank() || value.startsWith("0001-")) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private <T> T call(String operation, String handle, Supplier<T> action) {
        try {
            return action.get();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(handle, e);
        } catch (BadRequestException | ConflictException e) {
            throw new RuntimeRejectedException("Docker rejected " + operation + " for " + handle + ": " + e.getMessage(), e);
        } catch (DockerException e) {
            throw new RuntimeUnavailableException("Docker error during " + operation + " for " + handle
                    + " (HTTP " + e.getHttpStatus() + ")", e);
        } catch (RuntimeException e) {
            throw new RuntimeUnavailableException("Docker unreachable during " + operation + " for " + handle
                    + ": " + e.getMessage(), e);
        }
    }
}
