package com.awesomeposter.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: awesomeposter serve
 * <p>
 * Starts the HTTP server exposing the run streaming and thread APIs. The web server is
 * enabled by {@link com.awesomeposter.AwesomePosterApplication#main} detecting "serve";
 * {@link CliRunner} then skips picocli and the banner is printed once the server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the orchestrator HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Orchestrator running on port " + port);
        System.out.println();
        System.out.println("  Stream runs:  POST http://localhost:" + port + "/api/v1/runs/stream");
        System.out.println("  Backlog:      GET  http://localhost:" + port + "/api/v1/runs/backlog");
        System.out.println("  Threads:      GET  http://localhost:" + port + "/api/v1/threads/{threadId}");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
