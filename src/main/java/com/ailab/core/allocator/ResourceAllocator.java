package com.ailab.core.allocator;

import com.ailab.core.error.InsufficientGpuCapacityException;
import com.ailab.core.error.PortsExhaustedException;
import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.model.Environment;
import com.ailab.core.model.PortMapping;
import com.ailab.core.telemetry.GpuUtilization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Picks free host ports and GPU indices.
 *
 * <p>The allocator holds no state of its own. What it picks becomes reserved when the caller
 * upserts an environment holding it, so {@link #reservePorts} and {@link #reserveGpus} must be
 * called inside {@link AllocationLedger#inWriteTransaction} together with that upsert.
 */
@Service
public class ResourceAllocator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    private static final Comparator<GpuUtilization> LEAST_USED_FIRST =
            Comparator.comparingInt(GpuUtilization::utilizationPct).thenComparingInt(GpuUtilization::index);

    private final AllocationLedger ledger;
    private final AllocatorProperties properties;

    public ResourceAllocator(AllocationLedger ledger, AllocatorProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    /**
     * Assigns one host port per container port, scanning the configured range upwards and
     * skipping ports held in the ledger or bound in the runtime.
     *
     * @throws PortsExhaustedException if the range has fewer free ports than requested
     */
    public List<PortMapping> reservePorts(List<Integer> containerPorts, Set<Integer> runtimeBoundPorts) {
        if (containerPorts.isEmpty()) {
            return List.of();
        }
        Set<Integer> held = ledger.allocatedHostPorts();
        var mappings = new ArrayList<PortMapping>(containerPorts.size());
        int next = 0;
        for (int port = properties.getPortRangeStart(); port <= properties.getPortRangeEnd()
                && next < containerPorts.size(); port++) {
            if (held.contains(port) || runtimeBoundPorts.contains(port)) {
                continue;
            }
            mappings.add(new PortMapping(containerPorts.get(next++), port));
        }
        if (mappings.size() < containerPorts.size()) {
            throw new PortsExhaustedException("Host port range " + properties.getPortRangeStart() + "-"
                    + properties.getPortRangeEnd() + " has " + mappings.size() + " free ports, "
                    + containerPorts.size() + " needed");
        }
        log.debug("Picked host ports {}", mappings);
        return mappings;
    }

    /**
     * Picks the {@code count} least-utilized GPUs not held in the ledger, ties broken by the
     * lower index. Normal callers only get GPUs below the utilization threshold; high-priority
     * callers may get busier ones.
     *
     * @throws InsufficientGpuCapacityException if not enough GPUs qualify
     */
    public Set<Integer> reserveGpus(int count, boolean highPriority, List<GpuUtilization> utilization) {
        if (count <= 0) {
            return Set.of();
        }
        Set<Integer> held = ledger.allocatedGpuIndices();
        List<GpuUtilization> candidates = utilization.stream()
                .filter(g -> !held.contains(g.index()))
                .sorted(LEAST_USED_FIRST)
                .toList();
        List<GpuUtilization> eligible = highPriority
                ? candidates
                : candidates.stream().filter(this::isAvailable).toList();

        if (eligible.size() < count) {
            long available = candidates.stream().filter(this::isAvailable).count();
            throw new InsufficientGpuCapacityException("Requested " + count + " GPUs; " + candidates.size()
                    + " unallocated of " + utilization.size() + ", " + available + " below "
                    + properties.getGpuUtilizationThreshold() + "% utilization");
        }
        var picked = new TreeSet<Integer>();
        eligible.stream().limit(count).forEach(g -> picked.add(g.index()));
        if (highPriority && picked.stream().anyMatch(i -> !isAvailable(find(utilization, i)))) {
            log.info("High-priority allocation took busy GPUs {}", picked);
        }
        return picked;
    }

    /**
     * Checks that a stopped environment can take its previous ports and GPUs back.
     *
     * @throws PortsExhaustedException          if one of its ports is now held or bound elsewhere
     * @throws InsufficientGpuCapacityException if one of its GPUs is now held, missing or busy
     */
    public void reacquire(Environment environment, boolean highPriority,
                          Set<Integer> runtimeBoundPorts, List<GpuUtilization> utilization) {
        Set<Integer> heldPorts = ledger.allocatedHostPorts();
        for (Integer port : environment.hostPorts()) {
            if (heldPorts.contains(port) || runtimeBoundPorts.contains(port)) {
                throw new PortsExhaustedException("Host port " + port + " of " + environment.id()
                        + " is now in use elsewhere");
            }
        }
        Set<Integer> heldGpus = ledger.allocatedGpuIndices();
        for (Integer index : environment.allocatedGpuIndices()) {
            GpuUtilization gpu = find(utilization, index);
            if (heldGpus.contains(index) || gpu == null || (!highPriority && !isAvailable(gpu))) {
                throw new InsufficientGpuCapacityException("GPU " + index + " of " + environment.id()
                        + " is no longer available");
            }
        }
    }

    /**
     * Describes what {@code environment} gives back. The ledger write that moves it to a
     * terminal status or removes it is what actually frees the resources; call this in the
     * same write transaction.
     */
    public ReleasedResources release(Environment environment) {
        var released = new ReleasedResources(environment.id(), environment.hostPorts(), environment.allocatedGpuIndices());
        if (!released.isEmpty()) {
            log.info("Releasing ports {} and GPUs {} of {}", released.hostPorts(), released.gpuIndices(), environment.id());
        }
        return released;
    }

    public Availability availability(Set<Integer> runtimeBoundPorts, List<GpuUtilization> utilization) {
        Set<Integer> heldPorts = ledger.allocatedHostPorts();
        int free = 0;
        for (int port = properties.getPortRangeStart(); port <= properties.getPortRangeEnd(); port++) {
            if (!heldPorts.contains(port) && !runtimeBoundPorts.contains(port)) {
                free++;
            }
        }
        Set<Integer> heldGpus = ledger.allocatedGpuIndices();
        var slots = utilization.stream()
                .sorted(Comparator.comparingInt(GpuUtilization::index))
                .map(g -> {
                    boolean allocated = heldGpus.contains(g.index());
                    return new Availability.GpuSlot(g.index(), g.utilizationPct(), allocated,
                            !allocated && isAvailable(g));
                })
                .toList();
        return new Availability(properties.getPortRangeStart(), properties.getPortRangeEnd(), free, slots);
    }

    private boolean isAvailable(GpuUtilization gpu) {
        return gpu != null && gpu.utilizationPct() < properties.getGpuUtilizationThreshold();
    }

    private static GpuUtilization find(List<GpuUtilization> utilization, int index) {
        for (GpuUtilization gpu : utilization) {
            if (gpu.index() == index) {
                return gpu;
            }
        }
        return null;
    }
}
