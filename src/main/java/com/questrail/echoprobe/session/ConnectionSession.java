package com.questrail.echoprobe.session;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.lifecycle.TaskTracker;
import com.questrail.echoprobe.observability.ConnectionEvent;
import com.questrail.echoprobe.observability.EchoProbeErrorEvent;
import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.scan.ScanTrigger;
import com.questrail.echoprobe.time.WallClock;
import com.questrail.echoprobe.transport.ConnectionListener;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * ConnectionSession
 * =============================================================================
 * Owns one accepted connection: records its lifecycle in the peer's log file,
 * optionally triggers a scan of the peer, and echoes every chunk it reads.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   onOpen              → "Connection from: ip:port", scan triggered if active
 *   onData (n > 0)      → "Received n bytes: [...]", same bytes returned for echo
 *   onPeerClosed        → "Connection closed by client"            (success)
 *   onIdleTimeout       → "Connection timed out due to inactivity" (success)
 *   onTransportShutdown → "Connection closed at shutdown"          (success)
 *   onFailure           → reported as DROPPED                      (failure)
 * </pre>
 *
 * <p>The transport serializes callbacks, so this class holds no locks. A
 * failure to write the peer log is an I/O failure of the connection.</p>
 *
 * <p>The triggered scan is fire-and-forget: it is neither awaited nor
 * cancelled when this connection ends.</p>
 */
public final class ConnectionSession implements ConnectionListener {

    private final EchoProbeConfig config;
    private final SessionLogDirectory logs;
    private final ScanTrigger scans;
    private final TaskTracker tracker;
    private final EchoProbeObservabilitySink sink;
    private final WallClock clock;

    private InetSocketAddress peer;
    private SessionLog log;
    private TaskTracker.Registration registration;

    public ConnectionSession(EchoProbeConfig config,
                             SessionLogDirectory logs,
                             ScanTrigger scans,
                             TaskTracker tracker,
                             EchoProbeObservabilitySink sink,
                             WallClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.logs = Objects.requireNonNull(logs, "logs");
        this.scans = Objects.requireNonNull(scans, "scans");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean onOpen(SocketAddress remote) {
        if (!(remote instanceof InetSocketAddress) || ((InetSocketAddress) remote).getAddress() == null) {
            // No usable peer address: nothing to log against.
            return false;
        }

        peer = (InetSocketAddress) remote;
        String ip = peer.getAddress().getHostAddress();

        try {
            log = logs.openPeerLog(ip);
            log.info("Connection from: " + ip + ":" + peer.getPort());
        } catch (IOException e) {
            closeLog();
            sink.onConnectionEvent(new ConnectionEvent(clock.now(), ConnectionEvent.Kind.DROPPED, peer, 0, e));
            return false;
        }

        registration = tracker.begin(TaskTracker.Kind.CONNECTION);
        sink.onConnectionEvent(new ConnectionEvent(clock.now(), ConnectionEvent.Kind.ACCEPTED, peer, 0, null));

        if (config.active()) {
            scans.trigger(ip, config);
        }
        return true;
    }

    @Override
    public byte[] onData(byte[] payload) throws IOException {
        log.info("Received " + payload.length + " bytes: " + formatBytes(payload));
        sink.onConnectionEvent(new ConnectionEvent(clock.now(), ConnectionEvent.Kind.DATA_ECHOED, peer, payload.length, null));
        return payload;
    }

    @Override
    public void onPeerClosed() {
        finish(ConnectionEvent.Kind.PEER_CLOSED, "Connection closed by client", null);
    }

    @Override
    public void onIdleTimeout() {
        finish(ConnectionEvent.Kind.TIMED_OUT, "Connection timed out due to inactivity", null);
    }

    @Override
    public void onTransportShutdown() {
        finish(ConnectionEvent.Kind.CLOSED_AT_SHUTDOWN, "Connection closed at shutdown", null);
    }

    @Override
    public void onFailure(Throwable cause) {
        if (peer == null) {
            sink.onError(new EchoProbeErrorEvent(clock.now(), "Connection failed before it was opened", cause));
            return;
        }
        finish(ConnectionEvent.Kind.DROPPED, "Connection dropped after I/O error: " + cause, cause);
    }

    private void finish(ConnectionEvent.Kind kind, String line, Throwable cause) {
        try {
            if (log != null) {
                if (cause == null) {
                    log.info(line);
                } else {
                    log.warn(line);
                }
            }
        } catch (IOException e) {
            sink.onError(new EchoProbeErrorEvent(clock.now(), "Failed to write connection log for " + peer, e));
        } finally {
            closeLog();
            sink.onConnectionEvent(new ConnectionEvent(clock.now(), kind, peer, 0, cause));
            if (registration != null) {
                registration.end();
            }
        }
    }

    private void closeLog() {
        SessionLog l = log;
        log = null;
        if (l == null) {
            return;
        }
        try {
            l.close();
        } catch (IOException e) {
            sink.onError(new EchoProbeErrorEvent(clock.now(), "Failed to close connection log " + l.path(), e));
        }
    }

    static String formatBytes(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 4 + 2).append('[');
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Byte.toUnsignedInt(bytes[i]));
        }
        return sb.append(']').toString();
    }
}
