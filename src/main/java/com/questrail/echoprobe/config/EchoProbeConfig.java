package com.questrail.echoprobe.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable process configuration.
 *
 * <p>One instance is loaded at startup and handed by reference to every
 * listener, connection and scan task. Nothing mutates it afterwards.</p>
 *
 * @param listenPorts          port specs to listen on; at least one
 * @param active               whether inbound connections trigger a scan of the peer
 * @param scanPorts            port specs probed on each scanned peer
 * @param connectionTimeout    inactivity bound for an echo connection
 * @param scanConnectTimeout   connect bound for each probed port
 * @param scanReadTimeout      bound on waiting for a banner from an open port
 * @param logDirectory         directory holding per-peer and per-scan logs
 * @param shutdownDrainTimeout how long shutdown waits for in-flight connections and scans
 */
public record EchoProbeConfig(
    List<String> listenPorts,
    boolean active,
    List<String> scanPorts,
    Duration connectionTimeout,
    Duration scanConnectTimeout,
    Duration scanReadTimeout,
    Path logDirectory,
    Duration shutdownDrainTimeout
) {
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SCAN_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SCAN_READ_TIMEOUT = Duration.ofSeconds(5);
    public static final Path DEFAULT_LOG_DIRECTORY = Path.of("logs");

    public EchoProbeConfig {
        Objects.requireNonNull(listenPorts, "listenPorts");
        Objects.requireNonNull(scanPorts, "scanPorts");
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(scanConnectTimeout, "scanConnectTimeout");
        Objects.requireNonNull(scanReadTimeout, "scanReadTimeout");
        Objects.requireNonNull(logDirectory, "logDirectory");
        Objects.requireNonNull(shutdownDrainTimeout, "shutdownDrainTimeout");

        if (listenPorts.isEmpty()) {
            throw new IllegalArgumentException("listenPorts must name at least one port");
        }
        requirePositive(connectionTimeout, "connectionTimeout");
        requirePositive(scanConnectTimeout, "scanConnectTimeout");
        requirePositive(scanReadTimeout, "scanReadTimeout");
        if (shutdownDrainTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownDrainTimeout must be non-negative");
        }

        listenPorts = List.copyOf(listenPorts);
        scanPorts = List.copyOf(scanPorts);
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> listenPorts = new ArrayList<>();
        private boolean active;
        private final List<String> scanPorts = new ArrayList<>();
        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
        private Duration scanConnectTimeout = DEFAULT_SCAN_CONNECT_TIMEOUT;
        private Duration scanReadTimeout = DEFAULT_SCAN_READ_TIMEOUT;
        private Path logDirectory = DEFAULT_LOG_DIRECTORY;
        private Duration shutdownDrainTimeout = Duration.ZERO;

        public Builder withListenPorts(List<String> specs) {
            this.listenPorts.clear();
            this.listenPorts.addAll(specs);
            return this;
        }

        public Builder addListenPort(String spec) {
            this.listenPorts.add(Objects.requireNonNull(spec, "spec"));
            return this;
        }

        public Builder withActive(boolean active) {
            this.active = active;
            return this;
        }

        public Builder withScanPorts(List<String> specs) {
            this.scanPorts.clear();
            this.scanPorts.addAll(specs);
            return this;
        }

        public Builder addScanPort(String spec) {
            this.scanPorts.add(Objects.requireNonNull(spec, "spec"));
            return this;
        }

        public Builder withConnectionTimeout(Duration timeout) {
            this.connectionTimeout = timeout;
            return this;
        }

        public Builder withScanConnectTimeout(Duration timeout) {
            this.scanConnectTimeout = timeout;
            return this;
        }

        public Builder withScanReadTimeout(Duration timeout) {
            this.scanReadTimeout = timeout;
            return this;
        }

        public Builder withLogDirectory(Path directory) {
            this.logDirectory = directory;
            return this;
        }

        public Builder withShutdownDrainTimeout(Duration timeout) {
            this.shutdownDrainTimeout = timeout;
            return this;
        }

        public EchoProbeConfig build() {
            return new EchoProbeConfig(
                listenPorts,
                active,
                scanPorts,
                connectionTimeout,
                scanConnectTimeout,
                scanReadTimeout,
                logDirectory,
                shutdownDrainTimeout
            );
        }
    }
}
