package com.ailab.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;

/**
 * Runs the {@code ailab} command line once the context is up and hands its exit code to
 * {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AilabCommand ailabCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AilabCommand ailabCommand, IFactory factory) {
        this.ailabCommand = ailabCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve is handled by the servlet context that AilabApplication starts for it
        if (List.of(args).contains(ServeCommand.NAME)) {
            return;
        }
        exitCode = new CommandLine(ailabCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
