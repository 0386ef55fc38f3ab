package com.questrail.echoprobe.scan;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.observability.EchoProbeErrorEvent;
import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.observability.ScanEvent;
import com.questrail.echoprobe.port.MalformedPortSpecException;
import com.questrail.echoprobe.port.PortSpec;
import com.questrail.echoprobe.port.PortSpecParser;
import com.questrail.echoprobe.session.SessionLog;
import com.questrail.echoprobe.session.SessionLogDirectory;
import com.questrail.echoprobe.time.WallClock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ScanEngine
 * =============================================================================
 * Probes a target's configured ports one after another and records what it
 * finds in {@code <target-ip>-scan.log}.
 *
 * <h2>Order of operations</h2>
 * <ol>
 *   <li>Inactive configuration: report {@code DISABLED} and do nothing.</li>
 *   <li>Resolve every scan spec; malformed specs and port 0 are skipped.</li>
 *   <li>If any resolved port is in {@code 1..1024} and the process lacks
 *       privilege, report one error and probe nothing.</li>
 *   <li>Open (truncate) the scan log.</li>
 *   <li>Probe each port sequentially. Per-port failures are logged and the
 *       scan moves on; nothing is retried.</li>
 * </ol>
 *
 * <h2>Scan log lines</h2>
 * <pre>
 *   [INFO] Port 22 is open
 *   [INFO] Received data from port 22: SSH-2.0-OpenSSH_9.6
 *   [INFO] 8080: No immediate data received or read timed out
 *   [WARN] Failed to connect to port 23: Connection refused
 * </pre>
 *
 * <p>A scan has no overall deadline and does not observe shutdown. It runs on
 * the caller's thread; {@link ScanLauncher} provides the background variant.</p>
 */
public final class ScanEngine {

    private final PortSpecParser parser;
    private final PortProber prober;
    private final PrivilegeCheck privileges;
    private final SessionLogDirectory logs;
    private final EchoProbeObservabilitySink sink;
    private final WallClock clock;

    public ScanEngine(PortSpecParser parser,
                      PortProber prober,
                      PrivilegeCheck privileges,
                      SessionLogDirectory logs,
                      EchoProbeObservabilitySink sink,
                      WallClock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.privileges = Objects.requireNonNull(privileges, "privileges");
        this.logs = Objects.requireNonNull(logs, "logs");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void scan(String targetIp, EchoProbeConfig config) {
        Objects.requireNonNull(targetIp, "targetIp");
        Objects.requireNonNull(config, "config");

        if (!config.active()) {
            sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.DISABLED, targetIp, -1, null));
            return;
        }

        List<Integer> ports = resolvePorts(targetIp, config.scanPorts());

        if (requiresPrivilege(ports) && !privileges.isPrivileged()) {
            sink.onError(new EchoProbeErrorEvent(clock.now(),
                "Root privileges are required for scanning well-known ports; scan of " + targetIp + " aborted",
                null));
            return;
        }

        sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.STARTED, targetIp, -1, null));

        try (SessionLog log = logs.openScanLog(targetIp)) {
            ScanSession session = new ScanSession(targetIp, ports, log);
            for (int port : session.ports()) {
                probePort(session, port, config);
            }
            sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.COMPLETED, targetIp, -1, session.summary()));
        } catch (IOException e) {
            sink.onError(new EchoProbeErrorEvent(clock.now(),
                "Port scan of " + targetIp + " abandoned: scan log could not be written", e));
        }
    }

    /**
     * Resolves scan specs in configuration order, dropping malformed specs and
     * port 0.
     */
    List<Integer> resolvePorts(String targetIp, List<String> specs) {
        List<Integer> ports = new ArrayList<>();
        for (String spec : specs) {
            try {
                for (int port : parser.resolve(spec)) {
                    if (port != 0) {
                        ports.add(port);
                    }
                }
            } catch (MalformedPortSpecException e) {
                sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.SPEC_SKIPPED, targetIp, -1, e.spec()));
            }
        }
        return ports;
    }

    static boolean requiresPrivilege(List<Integer> ports) {
        for (int port : ports) {
            if (port > 0 && port <= PortSpec.PRIVILEGED_CEILING) {
                return true;
            }
        }
        return false;
    }

    private void probePort(ScanSession session, int port, EchoProbeConfig config) throws IOException {
        String target = session.targetIp();
        SessionLog log = session.log();

        ProbeResult result = prober.probe(target, port, config.scanConnectTimeout(), config.scanReadTimeout());

        if (result instanceof ProbeResult.Open) {
            ProbeResult.Open open = (ProbeResult.Open) result;
            session.recordProbe(true);
            log.info("Port " + port + " is open");
            sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.PORT_OPEN, target, port, null));

            if (open.hasBanner()) {
                String text = new String(open.banner(), StandardCharsets.UTF_8);
                log.info("Received data from port " + port + ": " + text);
                sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.DATA_RECEIVED, target, port, text));
            } else {
                log.info(port + ": No immediate data received or read timed out");
                sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.NO_DATA, target, port, null));
            }
        } else {
            ProbeResult.ConnectFailed failed = (ProbeResult.ConnectFailed) result;
            session.recordProbe(false);
            log.warn("Failed to connect to port " + port + ": " + failed.reason());
            sink.onScanEvent(new ScanEvent(clock.now(), ScanEvent.Kind.CONNECT_FAILED, target, port, failed.reason()));
        }
    }
}
