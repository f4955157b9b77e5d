package com.marketpulse.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: marketpulse serve
 * <p>
 * Starts the REST API and SSE event streaming. The web server is enabled by
 * {@link com.marketpulse.MarketPulseApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli so the server keeps the JVM alive.
 * The banner is printed once Tomcat reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the MarketPulse HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("MarketPulse server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
