package com.ailab.dispatch.cli;

import com.ailab.core.error.EnvironmentException;
import com.ailab.core.reconcile.Reconciler;
import com.ailab.core.reconcile.ReconciliationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: ailab reconcile
 * <p>
 * Runs one reconciliation pass against the live runtime and prints what was repaired.
 */
@Command(name = "reconcile", mixinStandardHelpOptions = true,
        description = "Align the ledger with the running containers")
@Component
public class ReconcileCommand implements Runnable {

    private final Reconciler reconciler;

    public ReconcileCommand(Reconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ReconciliationReport report;
        try {
            report = reconciler.reconcile();
        } catch (EnvironmentException e) {
            ConsoleOutput.error("Reconciliation failed (" + e.code().code() + "): " + e.getMessage());
            return;
        }

        ConsoleOutput.info("Pass " + report.pass() + ": " + report.liveContainers() + " containers, "
                + report.ledgerEntries() + " ledger entries (" + report.duration().toMillis() + "ms)");
        section("Stale entries failed", report.staleFailed());
        section("Orphans adopted", report.orphansAdopted());
        section("Drift corrected", report.driftCorrected());
        section("Conflicts quarantined", report.conflictsQuarantined());
        section("Skipped (in flight)", report.skippedInFlight());
        if (report.indexRepaired()) {
            ConsoleOutput.warn("Allocation indexes were inconsistent and have been rebuilt");
        }
        for (String id : report.quarantinedEntries()) {
            ConsoleOutput.error("Unreadable ledger entry needs attention: " + id);
        }
        report.errors().forEach((id, message) -> ConsoleOutput.error(id + ": " + message));

        System.out.println("──────────────────────────────────");
        if (report.clean()) {
            ConsoleOutput.success("Ledger matches the runtime");
        } else if (report.errors().isEmpty()) {
            ConsoleOutput.success(report.repairs() + " repairs applied");
        } else {
            ConsoleOutput.error(report.errors().size() + " entries could not be reconciled");
        }
    }

    private static void section(String title, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        ConsoleOutput.warn(title + " (" + ids.size() + "):");
        ids.forEach(id -> System.out.println("    " + id));
    }
}
