package com.ailab.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ailab serve
 * <p>
 * Starts the environment manager as a long-running HTTP server exposing the REST API
 * and the scheduled reconciler. The web server is enabled by
 * {@link com.ailab.AilabApplication#main} detecting "serve" in args.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 ailab serve}
 */
@Command(name = ServeCommand.NAME, mixinStandardHelpOptions = true,
        description = "Start the environment manager HTTP server")
@Component
public class ServeCommand implements Runnable {

    public static final String NAME = "serve";

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; CliRunner skips picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Environment manager running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
