package com.questrail.echoprobe.listener;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.lifecycle.ShutdownSignal;
import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.observability.ListenerEvent;
import com.questrail.echoprobe.port.MalformedPortSpecException;
import com.questrail.echoprobe.port.PortSpecParser;
import com.questrail.echoprobe.time.WallClock;
import com.questrail.echoprobe.transport.TcpListenerBinder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ListenerManager
 * =============================================================================
 * Binds one listener per resolved port and keeps them accepting until the
 * shutdown signal closes.
 *
 * <h2>Failure isolation</h2>
 * <ul>
 *   <li>A malformed spec is reported and skipped; sibling specs still bind.</li>
 *   <li>A port that fails to bind is reported and skipped; the remaining ports
 *       still bind and startup continues.</li>
 * </ul>
 *
 * <h2>Accept loops</h2>
 * Each bound port accepts independently and hands every connection to a new
 * handler from the {@link ConnectionListenerFactory} without waiting for it.
 * When the shutdown signal closes, every listener is closed and no further
 * connections are accepted. Handlers and scans already running are not
 * stopped.
 */
public final class ListenerManager {

    private final TcpListenerBinder binder;
    private final PortSpecParser parser;
    private final ConnectionListenerFactory connections;
    private final EchoProbeObservabilitySink sink;
    private final WallClock clock;

    public ListenerManager(TcpListenerBinder binder,
                           PortSpecParser parser,
                           ConnectionListenerFactory connections,
                           EchoProbeObservabilitySink sink,
                           WallClock clock) {
        this.binder = Objects.requireNonNull(binder, "binder");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Binds every resolvable port and arms each listener to close on
     * {@code shutdown}. Returns without waiting.
     *
     * @return handles for the ports that bound, in spec order
     */
    public List<ListenerHandle> start(List<String> ports, ShutdownSignal shutdown, EchoProbeConfig config) {
        Objects.requireNonNull(ports, "ports");
        Objects.requireNonNull(shutdown, "shutdown");
        Objects.requireNonNull(config, "config");

        List<ListenerHandle> handles = new ArrayList<>();
        for (String spec : ports) {
            final List<Integer> resolved;
            try {
                resolved = parser.resolve(spec);
            } catch (MalformedPortSpecException e) {
                sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.SPEC_REJECTED, e.spec(), -1, e));
                continue;
            }

            if (resolved.isEmpty()) {
                sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.SPEC_EMPTY, spec, -1, null));
                continue;
            }

            for (int port : resolved) {
                bindOne(spec, port, shutdown, config).ifPresent(handles::add);
            }
        }
        return Collections.unmodifiableList(handles);
    }

    /**
     * Binds the listeners and blocks until {@code shutdown} closes.
     *
     * <p>Returns as soon as the listeners are closed, whether or not the
     * connections and scans they spawned have finished. If the calling thread
     * is interrupted, the listeners are closed and the interrupt is preserved.</p>
     */
    public void run(List<String> ports, ShutdownSignal shutdown, EchoProbeConfig config) {
        List<ListenerHandle> handles = start(ports, shutdown, config);
        try {
            shutdown.awaitClosed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handles.forEach(ListenerHandle::close);
        }
        sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.ALL_STOPPED, "", -1, null));
    }

    private Optional<ListenerHandle> bindOne(String spec, int port, ShutdownSignal shutdown, EchoProbeConfig config) {
        final ListenerHandle handle;
        try {
            handle = new ListenerHandle(spec, port,
                binder.bind(port, () -> connections.newConnection(config)),
                sink, clock);
        } catch (IOException e) {
            sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.BIND_FAILED, spec, port, e));
            return Optional.empty();
        }

        sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.BOUND, spec, handle.localPort(), null));
        shutdown.onClose(handle::close);
        return Optional.of(handle);
    }
}
