package com.switchyard.dispatch.cli;

import com.switchyard.core.connectivity.ConnectivityMonitor;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.router.RouterProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchyard serve
 * <p>
 * Selecting this command makes {@link com.switchyard.SwitchyardApplication} start the
 * web server and {@link CliRunner} step aside, so the summary below is printed from
 * the {@link WebServerInitializedEvent} once the port is known.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Switchyard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final OfflineQueue queue;
    private final ConnectivityMonitor connectivity;
    private final RouterProperties routerProperties;

    public ServeCommand(OfflineQueue queue, ConnectivityMonitor connectivity, RouterProperties routerProperties) {
        this.queue = queue;
        this.connectivity = connectivity;
        this.routerProperties = routerProperties;
    }

    @Override
    public void run() {
        printSummary(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printSummary(event.getWebServer().getPort());
    }

    private void printSummary(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Switchyard server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Metrics:  http://localhost:" + port + "/actuator/metrics");
        System.out.println("  Remote:   " + routerProperties.getRemote().getEndpoint()
                + (connectivity.isOnline() ? " (online)" : " (offline)"));
        System.out.println("  Jobs:     " + queue.storeDescription()
                + ", " + queue.status().queued() + " queued");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
