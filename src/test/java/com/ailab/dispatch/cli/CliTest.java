package com.ailab.dispatch.cli;

import com.ailab.core.health.HealthCheckService;
import com.ailab.core.health.HealthStatus;
import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import com.ailab.core.model.EnvironmentStatus;
import com.ailab.core.model.PortMapping;
import com.ailab.core.model.ResourceLimits;
import com.ailab.core.reconcile.Reconciler;
import com.ailab.core.reconcile.ReconciliationReport;
import com.ailab.core.template.ConfiguredTemplateCatalog;
import com.ailab.core.template.EnvironmentTemplate;
import com.ailab.core.template.TemplateCatalog;
import com.ailab.runtime.RuntimeUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the ailab CLI command structure.
 * These tests exercise picocli directly without Spring context, with the core
 * services mocked through a custom {@link CommandLine.IFactory}.
 */
class CliTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private LifecycleManager lifecycleManager;
    private Reconciler reconciler;
    private HealthCheckService healthCheckService;
    private TemplateCatalog templateCatalog;

    @BeforeEach
    void setUp() {
        lifecycleManager = mock(LifecycleManager.class);
        reconciler = mock(Reconciler.class);
        healthCheckService = mock(HealthCheckService.class);
        templateCatalog = new ConfiguredTemplateCatalog(List.of(
                new EnvironmentTemplate("vscode", "VS Code Development", "ai-lab-vscode", List.of(8080), 2.0, 8192, 1)));
    }

    private static Environment env(String id, String owner, EnvironmentStatus status) {
        return new Environment(id, owner, "vscode", status, List.of(new PortMapping(8080, 8800)), Set.of(1),
                new ResourceLimits(2.0, 8192), "c-1", null, T0, null, null);
    }

    private static ReconciliationReport report(List<String> stale, Map<String, String> errors) {
        return new ReconciliationReport(1, T0, T0.plusMillis(15), 3, 4, stale, List.of(), List.of(),
                List.of(), false, List.of(), List.of(), errors);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == EnvsCommand.class) {
                    return (K) new EnvsCommand(lifecycleManager);
                }
                if (cls == ReconcileCommand.class) {
                    return (K) new ReconcileCommand(reconciler);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == TemplatesCommand.class) {
                    return (K) new TemplatesCommand(templateCatalog);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AilabCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "envs", "reconcile", "health", "templates", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AI Lab Environment Manager 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: ailab"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("bogus").exitCode());
        }
    }

    @Nested
    @DisplayName("envs")
    class EnvsTests {

        @Test
        @DisplayName("lists every environment as the operator")
        void listsAll() {
            when(lifecycleManager.listAll(any(Caller.class))).thenReturn(List.of(
                    env("ai-lab-env-vscode-aaaa1111", "alice", EnvironmentStatus.RUNNING),
                    env("ai-lab-env-vscode-bbbb2222", "bob", EnvironmentStatus.STOPPED)));

            CliResult result = execute("envs");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Environments (2)"));
            assertTrue(result.output().contains("ai-lab-env-vscode-aaaa1111"));
            assertTrue(result.output().contains("bob"));
            verify(lifecycleManager).listAll(Caller.admin(EnvsCommand.OPERATOR));
        }

        @Test
        @DisplayName("--user filters to one owner")
        void filtersByUser() {
            when(lifecycleManager.listForUser("alice")).thenReturn(List.of(
                    env("ai-lab-env-vscode-aaaa1111", "alice", EnvironmentStatus.RUNNING)));

            CliResult result = execute("envs", "--user", "alice");

            assertTrue(result.output().contains("Environments (1)"));
            verify(lifecycleManager, never()).listAll(any());
        }

        @Test
        @DisplayName("--user and --all are mutually exclusive")
        void exclusiveScope() {
            assertNotEquals(0, execute("envs", "--user", "alice", "--all").exitCode());
        }

        @Test
        @DisplayName("empty ledger")
        void empty() {
            when(lifecycleManager.listForUser("carol")).thenReturn(List.of());

            assertTrue(execute("envs", "-u", "carol").output().contains("No environments for carol."));
        }
    }

    @Nested
    @DisplayName("reconcile")
    class ReconcileTests {

        @Test
        @DisplayName("clean pass")
        void clean() {
            when(reconciler.reconcile()).thenReturn(report(List.of(), Map.of()));

            CliResult result = execute("reconcile");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Pass 1: 3 containers, 4 ledger entries"));
            assertTrue(result.output().contains("Ledger matches the runtime"));
        }

        @Test
        @DisplayName("repairs and errors are listed")
        void repairs() {
            when(reconciler.reconcile()).thenReturn(report(List.of("ai-lab-env-gone"),
                    Map.of("ai-lab-env-stuck", "runtime_unavailable")));

            String output = execute("reconcile").output();

            assertTrue(output.contains("Stale entries failed (1)"));
            assertTrue(output.contains("ai-lab-env-gone"));
            assertTrue(output.contains("ai-lab-env-stuck: runtime_unavailable"));
            assertTrue(output.contains("1 entries could not be reconciled"));
        }

        @Test
        @DisplayName("runtime down is reported, not thrown")
        void runtimeDown() {
            when(reconciler.reconcile()).thenThrow(new RuntimeUnavailableException("Docker unreachable", null));

            CliResult result = execute("reconcile");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Reconciliation failed (runtime_unavailable)"));
        }
    }

    @Nested
    @DisplayName("health and templates")
    class HealthAndTemplates {

        @Test
        @DisplayName("health prints each component and the overall status")
        void health() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("ledger", HealthStatus.Status.UP, "2 environments tracked", Map.of()),
                    new HealthStatus("runtime", HealthStatus.Status.DOWN, "Runtime did not answer", Map.of())));

            String output = execute("health").output();

            assertTrue(output.contains("ledger: 2 environments tracked"));
            assertTrue(output.contains("runtime: Runtime did not answer"));
            assertTrue(output.contains("Overall: one or more components down"));
        }

        @Test
        @DisplayName("templates lists the catalog")
        void templates() {
            String output = execute("templates").output();

            assertTrue(output.contains("Templates (1)"));
            assertTrue(output.contains("VS Code Development"));
        }
    }

    @Nested
    @DisplayName("CliRunner")
    class Runner {

        @Test
        @DisplayName("runs a one-shot command and keeps its exit code")
        void oneShot() {
            var runner = new CliRunner(new AilabCommand(), createFactory());

            PrintStream originalErr = System.err;
            System.setErr(new PrintStream(new ByteArrayOutputStream(), true));
            try {
                runner.run("no-such-command");
            } finally {
                System.setErr(originalErr);
            }

            assertEquals(CommandLine.ExitCode.USAGE, runner.getExitCode());
        }

        @Test
        @DisplayName("leaves serve to the web context")
        void serveSkipped() {
            var factory = mock(CommandLine.IFactory.class);
            var runner = new CliRunner(new AilabCommand(), factory);

            runner.run(ServeCommand.NAME);

            assertEquals(0, runner.getExitCode());
            verifyNoInteractions(factory);
        }
    }
}
