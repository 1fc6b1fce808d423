package com.ailab.core.ledger;

import com.ailab.core.model.Environment;
import com.ailab.core.model.EnvironmentStatus;
import com.ailab.core.model.PortMapping;
import com.ailab.core.model.QuotaTier;
import com.ailab.core.model.ResourceLimits;
import com.ailab.core.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AllocationLedgerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private InMemoryLedgerStore store;
    private AllocationLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        ledger = new AllocationLedger(store, Clock.fixed(T0, ZoneOffset.UTC));
    }

    private static Environment env(String id, String owner, EnvironmentStatus status, int port, Set<Integer> gpus,
                                   Instant createdAt) {
        return new Environment(id, owner, "vscode", status, List.of(new PortMapping(8080, port)), gpus,
                new ResourceLimits(2.0, 8192), null, null, createdAt, null, null);
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("listByOwner returns only that owner's entries, oldest first")
        void listByOwner() {
            ledger.upsert(env("b", "alice", EnvironmentStatus.RUNNING, 8801, Set.of(), T0.plusSeconds(10)));
            ledger.upsert(env("x", "bob", EnvironmentStatus.RUNNING, 8802, Set.of(), T0));
            ledger.upsert(env("a", "alice", EnvironmentStatus.STOPPED, 8800, Set.of(), T0));

            assertEquals(List.of("a", "b"), ledger.listByOwner("alice").stream().map(Environment::id).toList());
            assertEquals(3, ledger.listAll().size());
            assertTrue(ledger.listByOwner("carol").isEmpty());
        }

        @Test
        @DisplayName("allocated sets only count entries that hold resources")
        void allocatedSets() {
            ledger.upsert(env("a", "alice", EnvironmentStatus.RUNNING, 8800, Set.of(0, 1), T0));
            ledger.upsert(env("b", "alice", EnvironmentStatus.CREATING, 8801, Set.of(2), T0));
            ledger.upsert(env("c", "alice", EnvironmentStatus.STOPPED, 8802, Set.of(3), T0));
            ledger.upsert(env("d", "alice", EnvironmentStatus.FAILED, 8803, Set.of(3), T0));

            assertEquals(Set.of(8800, 8801), ledger.allocatedHostPorts());
            assertEquals(Set.of(0, 1, 2), ledger.allocatedGpuIndices());
        }

        @Test
        @DisplayName("snapshots do not change when the ledger does")
        void snapshotIsImmutable() {
            ledger.upsert(env("a", "alice", EnvironmentStatus.RUNNING, 8800, Set.of(0), T0));
            LedgerSnapshot snapshot = ledger.snapshot();

            ledger.remove("a");

            assertTrue(snapshot.get("a").isPresent());
            assertEquals(Set.of(0), snapshot.allocatedGpuIndices());
            assertEquals(T0, snapshot.takenAt());
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("every mutation is persisted with recomputed indexes")
        void persistsOnEveryWrite() {
            ledger.upsert(env("a", "alice", EnvironmentStatus.RUNNING, 8800, Set.of(0), T0));

            LedgerDocument saved = store.load();
            assertEquals(List.of(8800), saved.allocatedHostPorts());
            assertEquals(List.of(0), saved.allocatedGpuIndices());

            ledger.upsert(env("a", "alice", EnvironmentStatus.STOPPED, 8800, Set.of(0), T0));
            assertTrue(store.load().allocatedGpuIndices().isEmpty());
            assertEquals(2, store.backups().size());
        }

        @Test
        @DisplayName("a failed save leaves the in-memory entry unchanged")
        void rollsBackOnPersistFailure() {
            var failing = new InMemoryLedgerStore() {
                boolean fail;

                @Override
                public synchronized void save(LedgerDocument document) {
                    if (fail) {
                        throw new UncheckedIOException(new IOException("disk full"));
                    }
                    super.save(document);
                }
            };
            var fragile = new AllocationLedger(failing, Clock.fixed(T0, ZoneOffset.UTC));
            Environment original = env("a", "alice", EnvironmentStatus.RUNNING, 8800, Set.of(0), T0);
            fragile.upsert(original);
            failing.fail = true;

            assertThrows(UncheckedIOException.class,
                    () -> fragile.upsert(env("a", "alice", EnvironmentStatus.STOPPED, 8800, Set.of(0), T0)));
            assertThrows(UncheckedIOException.class,
                    () -> fragile.upsert(env("b", "bob", EnvironmentStatus.RUNNING, 8801, Set.of(1), T0)));
            assertThrows(UncheckedIOException.class, () -> fragile.remove("a"));

            assertEquals(original, fragile.get("a").orElseThrow());
            assertTrue(fragile.get("b").isEmpty());
        }

        @Test
        @DisplayName("remove of an unknown id returns empty and writes nothing")
        void removeUnknown() {
            assertTrue(ledger.remove("nope").isEmpty());
            assertTrue(store.backups().isEmpty());
        }

        @Test
        @DisplayName("users are recorded once with their first-seen time")
        void recordUserOnce() {
            ledger.recordUser(new User("alice", QuotaTier.DEFAULT, T0));
            ledger.recordUser(new User("alice", QuotaTier.PREMIUM, T0.plusSeconds(60)));

            User alice = ledger.user("alice").orElseThrow();
            assertEquals(QuotaTier.DEFAULT, alice.quotaTier());
            assertEquals(T0, alice.firstSeenAt());
            assertEquals(1, store.backups().size());
        }
    }

    @Nested
    @DisplayName("index verification")
    class Indexes {

        @Test
        @DisplayName("stored indexes that disagree with the entries are detected and rebuilt")
        void detectsAndRebuilds() {
            Environment stopped = env("a", "alice", EnvironmentStatus.STOPPED, 8800, Set.of(0), T0);
            var corrupt = new InMemoryLedgerStore(new LedgerDocument(LedgerDocument.CURRENT_VERSION,
                    Map.of("a", stopped), List.of(8800), List.of(0), Map.of(), Map.of()));
            var loaded = new AllocationLedger(corrupt, Clock.fixed(T0, ZoneOffset.UTC));

            IndexVerification verification = loaded.verifyIndexes();
            assertFalse(verification.consistent());
            assertEquals(Set.of(8800), verification.storedHostPorts());
            assertTrue(verification.expectedHostPorts().isEmpty());

            loaded.rebuildIndexes();

            assertTrue(loaded.verifyIndexes().consistent());
            assertTrue(corrupt.load().allocatedHostPorts().isEmpty());
        }

        @Test
        @DisplayName("quarantined entries survive a load and a save")
        void quarantineCarriedThrough() {
            var withQuarantine = new InMemoryLedgerStore(new LedgerDocument(LedgerDocument.CURRENT_VERSION,
                    Map.of(), List.of(), List.of(), Map.of(), Map.of("broken", "{")));
            var loaded = new AllocationLedger(withQuarantine, Clock.fixed(T0, ZoneOffset.UTC));

            loaded.upsert(env("a", "alice", EnvironmentStatus.RUNNING, 8800, Set.of(), T0));

            assertEquals(Map.of("broken", "{"), loaded.quarantined());
            assertEquals(Map.of("broken", "{"), withQuarantine.load().quarantine());
        }
    }
}
