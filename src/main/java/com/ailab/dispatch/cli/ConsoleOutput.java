package com.ailab.dispatch.cli;

import com.ailab.core.model.Environment;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the ailab CLI.
 */
public class ConsoleOutput {

    static final String ENV_ROW = "  %-36s %-16s %-10s %-14s %-12s %s%n";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AI LAB ENVIRONMENT MANAGER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AILAB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void environmentHeader() {
        System.out.printf(ENV_ROW, "ENVIRONMENT", "OWNER", "STATUS", "PORTS", "GPUS", "TEMPLATE");
        System.out.println("  " + "-".repeat(100));
    }

    public static void environment(Environment env) {
        String color = switch (env.status()) {
            case RUNNING -> "fg(green)";
            case FAILED, ORPHANED -> "fg(red)";
            case STOPPED -> "fg(white)";
            default -> "fg(yellow)";
        };
        String status = CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + pad(env.status().name(), 10) + "|@");
        System.out.printf("  %-36s %-16s %s %-14s %-12s %s%n",
                env.id(),
                env.ownerId(),
                status,
                env.hostPorts().isEmpty() ? "-" : join(env.hostPorts()),
                env.allocatedGpuIndices().isEmpty() ? "-" : join(env.allocatedGpuIndices()),
                env.templateId() != null ? env.templateId() : "-");
    }

    private static String join(Iterable<Integer> values) {
        var sb = new StringBuilder();
        for (Integer v : values) {
            if (sb.length() > 0) sb.append(',');
            sb.append(v);
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
