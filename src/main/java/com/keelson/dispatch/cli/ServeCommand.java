package com.keelson.dispatch.cli;

import com.keelson.core.security.SessionAuthService;
import com.keelson.core.workdir.WorkdirRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: keelson serve
 * <p>
 * Runs the HTTP and WebSocket server. The web server is enabled by
 * {@link com.keelson.KeelsonApplication#main} when "serve" is among the arguments, and
 * {@link CliRunner} skips picocli in that mode so Tomcat keeps the JVM alive. The banner,
 * including the login link when auth is on, is printed once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Keelson server")
@Component
public class ServeCommand implements Runnable {

    private final SessionAuthService authService;
    private final WorkdirRegistry workdirs;

    @Value("${server.port:8080}")
    private int port;

    public ServeCommand(SessionAuthService authService, WorkdirRegistry workdirs) {
        this.authService = authService;
        this.workdirs = workdirs;
    }

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Keelson server running on port " + port);
        ConsoleOutput.info(workdirs.projects().size() + " project(s), "
                + workdirs.workdirs().size() + " workdir(s)");
        System.out.println();
        System.out.println("  Events:  ws://localhost:" + port + "/api/events");
        System.out.println("  API:     http://localhost:" + port + "/api");
        if (authService.isEnabled()) {
            System.out.println("  Login:   http://localhost:" + port + "/auth?token=" + authService.token());
        }
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
