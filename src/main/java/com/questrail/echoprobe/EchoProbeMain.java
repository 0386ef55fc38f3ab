package com.questrail.echoprobe;

import com.questrail.echoprobe.config.ConfigException;
import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.config.EnvironmentConfigLoader;
import com.questrail.echoprobe.observability.Slf4jEchoProbeObservabilitySink;
import com.questrail.echoprobe.runtime.EchoProbeRuntime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Process entry point.
 *
 * <p>Loads configuration from the environment (and {@code ./.env}), binds the
 * configured listeners and runs until the JVM receives SIGINT or SIGTERM.</p>
 */
public final class EchoProbeMain {
    private static final Duration HOOK_WAIT = Duration.ofSeconds(30);

    private EchoProbeMain() {}

    public static void main(String[] args) {
        // No logger may be created before the logging variables are exported.
        final EnvironmentConfigLoader loader;
        try {
            loader = EnvironmentConfigLoader.fromProcessEnvironment(Path.of(".env"));
        } catch (ConfigException e) {
            exitOnConfigError(e);
            return;
        }
        loader.exportLoggingProperties();

        final EchoProbeConfig config;
        try {
            config = loader.load();
        } catch (ConfigException e) {
            exitOnConfigError(e);
            return;
        }

        Logger log = LoggerFactory.getLogger(EchoProbeMain.class);

        log.info("Starting echoprobe: ports={}, active={}, scanPorts={}, timeout={}s",
            config.listenPorts(), config.active(), config.scanPorts(), config.connectionTimeout().toSeconds());

        EchoProbeRuntime runtime = EchoProbeRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jEchoProbeObservabilitySink())
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Received termination signal, initiating shutdown...");
            runtime.shutdownSignal().close();
            try {
                if (!runtime.awaitTermination(HOOK_WAIT)) {
                    log.warn("Shutdown did not finish within {}s", HOOK_WAIT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "echoprobe-shutdown"));

        int leftRunning = runtime.run();
        if (leftRunning > 0) {
            log.warn("{} connection or scan task(s) still running at shutdown", leftRunning);
        }
        log.info("Application shutdown complete.");
    }

    private static void exitOnConfigError(ConfigException e) {
        LoggerFactory.getLogger(EchoProbeMain.class).error("Failed to load configuration: {}", e.getMessage());
        System.exit(1);
    }
}
