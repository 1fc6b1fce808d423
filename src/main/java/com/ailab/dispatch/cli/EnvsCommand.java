package com.ailab.dispatch.cli;

import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: ailab envs
 * <p>
 * Lists environments from the ledger, either one user's or all of them. Runs with
 * operator rights since it reads the ledger on the host directly.
 */
@Command(name = "envs", mixinStandardHelpOptions = true, description = "List environments")
@Component
public class EnvsCommand implements Runnable {

    static final String OPERATOR = "cli-operator";

    @ArgGroup(exclusive = true)
    private Scope scope;

    static class Scope {
        @Option(names = {"--user", "-u"}, description = "Only environments owned by this user")
        String user;

        @Option(names = {"--all", "-a"}, description = "Environments of every user (default)")
        boolean all;
    }

    private final LifecycleManager lifecycleManager;

    public EnvsCommand(LifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Environment> envs = scope != null && scope.user != null
                ? lifecycleManager.listForUser(scope.user)
                : lifecycleManager.listAll(Caller.admin(OPERATOR));

        if (envs.isEmpty()) {
            ConsoleOutput.info(scope != null && scope.user != null
                    ? "No environments for " + scope.user + "."
                    : "No environments.");
            return;
        }

        ConsoleOutput.info("Environments (" + envs.size() + "):");
        System.out.println();
        ConsoleOutput.environmentHeader();
        envs.forEach(ConsoleOutput::environment);
    }
}
