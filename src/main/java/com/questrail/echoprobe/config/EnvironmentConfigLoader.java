package com.questrail.echoprobe.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * EnvironmentConfigLoader
 * =============================================================================
 * Builds an {@link EchoProbeConfig} from environment variables.
 *
 * <h2>Variables</h2>
 * <ul>
 *   <li><b>PORTS</b> (required) - comma-separated listening port specs</li>
 *   <li><b>ACTIVE</b> - exactly {@code true} enables scanning; default {@code false}</li>
 *   <li><b>SCAN_PORTS</b> - comma-separated scan port specs; default none</li>
 *   <li><b>CONNECTION_TIMEOUT_SECS</b> - positive integer; default 30</li>
 *   <li><b>SCAN_CONNECT_TIMEOUT_SECS</b> - positive integer; default 10</li>
 *   <li><b>SCAN_READ_TIMEOUT_SECS</b> - positive integer; default 5</li>
 *   <li><b>LOG_DIR</b> - log directory; default {@code logs}</li>
 *   <li><b>SHUTDOWN_DRAIN_SECS</b> - non-negative integer; default 0</li>
 *   <li><b>LOG_LEVEL</b> - process log level, read by Logback; default INFO</li>
 * </ul>
 *
 * <p>An optional {@code .env} file ({@code KEY=VALUE} lines, {@code #} comments)
 * supplies values for variables the process environment does not define. The
 * process environment always wins.</p>
 *
 * <p>Logback resolves {@code LOG_DIR} and {@code LOG_LEVEL} on its own, and
 * only sees the process environment and system properties. Call
 * {@link #exportLoggingProperties()} before the first logger is created so
 * values from {@code .env} reach it too.</p>
 *
 * <p>Every problem is reported as a {@link ConfigException}.</p>
 */
public final class EnvironmentConfigLoader {

    public static final String PORTS = "PORTS";
    public static final String ACTIVE = "ACTIVE";
    public static final String SCAN_PORTS = "SCAN_PORTS";
    public static final String CONNECTION_TIMEOUT_SECS = "CONNECTION_TIMEOUT_SECS";
    public static final String SCAN_CONNECT_TIMEOUT_SECS = "SCAN_CONNECT_TIMEOUT_SECS";
    public static final String SCAN_READ_TIMEOUT_SECS = "SCAN_READ_TIMEOUT_SECS";
    public static final String LOG_DIR = "LOG_DIR";
    public static final String SHUTDOWN_DRAIN_SECS = "SHUTDOWN_DRAIN_SECS";
    public static final String LOG_LEVEL = "LOG_LEVEL";

    private static final List<String> LOGGING_VARIABLES = List.of(LOG_DIR, LOG_LEVEL);

    private final Map<String, String> environment;

    public EnvironmentConfigLoader(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    /**
     * Loader over the process environment, layered on top of {@code dotEnvFile}
     * when that file exists.
     */
    public static EnvironmentConfigLoader fromProcessEnvironment(Path dotEnvFile) {
        Map<String, String> merged = new HashMap<>(readDotEnv(dotEnvFile));
        merged.putAll(System.getenv());
        return new EnvironmentConfigLoader(merged);
    }

    static Map<String, String> readDotEnv(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }

        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        Map<String, String> values = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            values.put(key, unquote(props.getProperty(key).trim()));
        }
        return values;
    }

    /**
     * The logging variables that are set to a non-blank value, trimmed.
     */
    Map<String, String> loggingProperties() {
        Map<String, String> values = new HashMap<>();
        for (String name : LOGGING_VARIABLES) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                values.put(name, value.trim());
            }
        }
        return values;
    }

    /**
     * Publishes {@code LOG_DIR} and {@code LOG_LEVEL} as system properties
     * for Logback. A system property that is already set is left alone.
     */
    public void exportLoggingProperties() {
        loggingProperties().forEach((name, value) -> {
            if (System.getProperty(name) == null) {
                System.setProperty(name, value);
            }
        });
    }

    public EchoProbeConfig load() {
        String ports = environment.get(PORTS);
        if (ports == null || ports.isBlank()) {
            throw new ConfigException(PORTS + " must be set to at least one port or port range");
        }

        List<String> listenPorts = splitList(ports);
        if (listenPorts.isEmpty()) {
            throw new ConfigException(PORTS + " must be set to at least one port or port range");
        }

        EchoProbeConfig.Builder builder = EchoProbeConfig.builder()
            .withListenPorts(listenPorts)
            .withActive("true".equals(environment.getOrDefault(ACTIVE, "false")))
            .withScanPorts(splitList(environment.getOrDefault(SCAN_PORTS, "")))
            .withConnectionTimeout(seconds(CONNECTION_TIMEOUT_SECS, EchoProbeConfig.DEFAULT_CONNECTION_TIMEOUT, false))
            .withScanConnectTimeout(seconds(SCAN_CONNECT_TIMEOUT_SECS, EchoProbeConfig.DEFAULT_SCAN_CONNECT_TIMEOUT, false))
            .withScanReadTimeout(seconds(SCAN_READ_TIMEOUT_SECS, EchoProbeConfig.DEFAULT_SCAN_READ_TIMEOUT, false))
            .withShutdownDrainTimeout(seconds(SHUTDOWN_DRAIN_SECS, Duration.ZERO, true));

        String logDir = environment.get(LOG_DIR);
        if (logDir != null && !logDir.isBlank()) {
            builder.withLogDirectory(Path.of(logDir.trim()));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private Duration seconds(String name, Duration fallback, boolean zeroAllowed) {
        String raw = environment.get(name);
        if (raw == null) {
            return fallback;
        }

        String expected = zeroAllowed ? " must be a non-negative integer" : " must be a positive integer";
        final long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(name + expected + ", got '" + raw + "'", e);
        }

        if (value < 0 || (value == 0 && !zeroAllowed)) {
            throw new ConfigException(name + expected + ", got '" + raw + "'");
        }
        return Duration.ofSeconds(value);
    }

    static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
