package com.ailab.core.reconcile;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What one reconciliation pass found and repaired.
 *
 * @param pass                 pass number since startup
 * @param startedAt            when the pass started
 * @param finishedAt           when the pass finished
 * @param liveContainers       containers the runtime reported
 * @param ledgerEntries        entries in the ledger snapshot
 * @param staleFailed          entries marked FAILED because their container is gone
 * @param orphansAdopted       containers registered into the ledger
 * @param driftCorrected       entries whose status was aligned with their container
 * @param conflictsQuarantined entries quarantined because another entry holds the same port or GPU
 * @param indexRepaired        whether the stored allocation indexes had to be rebuilt
 * @param quarantinedEntries   unreadable ledger entries awaiting an operator
 * @param skippedInFlight      entries left alone because a runtime call is in progress
 * @param errors               environment or container id to the error that stopped its repair
 */
public record ReconciliationReport(
    long pass,
    Instant startedAt,
    Instant finishedAt,
    int liveContainers,
    int ledgerEntries,
    List<String> staleFailed,
    List<String> orphansAdopted,
    List<String> driftCorrected,
    List<String> conflictsQuarantined,
    boolean indexRepaired,
    List<String> quarantinedEntries,
    List<String> skippedInFlight,
    Map<String, String> errors
) {

    public ReconciliationReport {
        staleFailed = List.copyOf(staleFailed);
        orphansAdopted = List.copyOf(orphansAdopted);
        driftCorrected = List.copyOf(driftCorrected);
        conflictsQuarantined = List.copyOf(conflictsQuarantined);
        quarantinedEntries = List.copyOf(quarantinedEntries);
        skippedInFlight = List.copyOf(skippedInFlight);
        errors = Map.copyOf(errors);
    }

    public int repairs() {
        return staleFailed.size() + orphansAdopted.size() + driftCorrected.size()
                + conflictsQuarantined.size() + (indexRepaired ? 1 : 0);
    }

    /** True when the ledger already matched the runtime and nothing failed. */
    public boolean clean() {
        return repairs() == 0 && errors.isEmpty();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
