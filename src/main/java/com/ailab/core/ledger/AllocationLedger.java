package com.ailab.core.ledger;

import com.ailab.core.model.Environment;
import com.ailab.core.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Authoritative record of every environment, its owner and the ports and GPU indices it holds.
 *
 * <p>All mutations run under a single write lock and are persisted before the lock is
 * released. Callers that need a check-then-write sequence (allocator reservation followed
 * by an upsert) wrap it in {@link #inWriteTransaction}. The lock is reentrant, so the
 * ledger's own methods can be called inside such a transaction.
 *
 * <p>The allocated port and GPU sets are derived from non-terminal entries on every
 * mutation. The sets read back from storage are kept separately so the reconciler can
 * detect a persisted index that disagrees with the entries.
 */
public class AllocationLedger {

    private static final Logger log = LoggerFactory.getLogger(AllocationLedger.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final LedgerStore store;
    private final Clock clock;

    private final Map<String, Environment> environments = new LinkedHashMap<>();
    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, String> quarantine = new LinkedHashMap<>();
    private Set<Integer> storedHostPorts;
    private Set<Integer> storedGpuIndices;

    public AllocationLedger(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        LedgerDocument document = store.load();
        environments.putAll(document.environments());
        users.putAll(document.users());
        quarantine.putAll(document.quarantine());
        storedHostPorts = new TreeSet<>(document.allocatedHostPorts());
        storedGpuIndices = new TreeSet<>(document.allocatedGpuIndices());
        log.info("Ledger loaded from {}: {} environments, {} users, {} quarantined",
                store.describe(), environments.size(), users.size(), quarantine.size());
    }

    public Optional<Environment> get(String envId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(environments.get(envId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Environments owned by {@code userId}, oldest first.
     */
    public List<Environment> listByOwner(String userId) {
        lock.readLock().lock();
        try {
            return environments.values().stream()
                    .filter(e -> e.ownerId().equals(userId))
                    .sorted(Comparator.comparing(Environment::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Environment> listAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(environments.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts or replaces the entry and persists the ledger. On a persistence failure the
     * in-memory entry is restored and the failure propagates.
     */
    public void upsert(Environment environment) {
        lock.writeLock().lock();
        try {
            Environment previous = environments.put(environment.id(), environment);
            try {
                persist();
            } catch (RuntimeException e) {
                if (previous != null) {
                    environments.put(environment.id(), previous);
                } else {
                    environments.remove(environment.id());
                }
                throw e;
            }
            log.debug("Ledger upsert {} -> {}", environment.id(), environment.status());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the entry and persists the ledger.
     *
     * @return the removed entry, if there was one
     */
    public Optional<Environment> remove(String envId) {
        lock.writeLock().lock();
        try {
            Environment removed = environments.remove(envId);
            if (removed == null) {
                return Optional.empty();
            }
            try {
                persist();
            } catch (RuntimeException e) {
                environments.put(envId, removed);
                throw e;
            }
            log.debug("Ledger removed {}", envId);
            return Optional.of(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records {@code user} unless a record with the same id already exists.
     */
    public void recordUser(User user) {
        lock.writeLock().lock();
        try {
            if (users.putIfAbsent(user.id(), user) == null) {
                try {
                    persist();
                } catch (RuntimeException e) {
                    users.remove(user.id());
                    throw e;
                }
                log.info("First allocation for user {} (tier {})", user.id(), user.quotaTier());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<User> user(String userId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(users.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public LedgerSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new LedgerSnapshot(environments, computeHostPorts(), computeGpuIndices(),
                    quarantine.keySet(), clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<Integer> allocatedHostPorts() {
        lock.readLock().lock();
        try {
            return computeHostPorts();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<Integer> allocatedGpuIndices() {
        lock.readLock().lock();
        try {
            return computeGpuIndices();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Raw text of entries that could not be read back from storage, keyed by environment id. */
    public Map<String, String> quarantined() {
        lock.readLock().lock();
        try {
            return Map.copyOf(quarantine);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code action} while holding the write lock, so that no other writer can interleave
     * between its reads and writes.
     */
    public <T> T inWriteTransaction(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void inWriteTransaction(Runnable action) {
        inWriteTransaction(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Compares the stored allocation indexes with those derived from the entries.
     */
    public IndexVerification verifyIndexes() {
        lock.readLock().lock();
        try {
            return new IndexVerification(Set.copyOf(storedHostPorts), computeHostPorts(),
                    Set.copyOf(storedGpuIndices), computeGpuIndices());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rewrites the stored indexes from the entries.
     */
    public void rebuildIndexes() {
        lock.writeLock().lock();
        try {
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String storeDescription() {
        return store.describe();
    }

    public boolean isStoreWritable() {
        return store.isWritable();
    }

    private void persist() {
        Set<Integer> ports = computeHostPorts();
        Set<Integer> gpus = computeGpuIndices();
        store.save(new LedgerDocument(LedgerDocument.CURRENT_VERSION, environments,
                List.copyOf(ports), List.copyOf(gpus), users, quarantine));
        storedHostPorts = ports;
        storedGpuIndices = gpus;
    }

    private Set<Integer> computeHostPorts() {
        var ports = new TreeSet<Integer>();
        for (Environment env : environments.values()) {
            if (env.holdsResources()) {
                ports.addAll(env.hostPorts());
            }
        }
        return ports;
    }

    private Set<Integer> computeGpuIndices() {
        var gpus = new TreeSet<Integer>();
        for (Environment env : environments.values()) {
            if (env.holdsResources()) {
                gpus.addAll(env.allocatedGpuIndices());
            }
        }
        return gpus;
    }
}
