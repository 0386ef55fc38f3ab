package com.questrail.echoprobe.listener;

import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.observability.ListenerEvent;
import com.questrail.echoprobe.time.WallClock;
import com.questrail.echoprobe.transport.BoundListener;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One successfully bound port and its accept loop.
 *
 * <p>The handle owns the bound socket until {@link #close()}, which the
 * shutdown signal invokes. Closing stops accepting; connections already
 * handed off keep running.</p>
 */
public final class ListenerHandle {

    private final String spec;
    private final int requestedPort;
    private final BoundListener bound;
    private final EchoProbeObservabilitySink sink;
    private final WallClock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ListenerHandle(String spec,
                   int requestedPort,
                   BoundListener bound,
                   EchoProbeObservabilitySink sink,
                   WallClock clock) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.requestedPort = requestedPort;
        this.bound = Objects.requireNonNull(bound, "bound");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * The spec this port was resolved from.
     */
    public String spec() {
        return spec;
    }

    public int requestedPort() {
        return requestedPort;
    }

    public int localPort() {
        return bound.localPort();
    }

    public boolean isOpen() {
        return !closed.get() && bound.isOpen();
    }

    /**
     * Stops the accept loop. Idempotent.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bound.close();
            sink.onListenerEvent(new ListenerEvent(clock.now(), ListenerEvent.Kind.STOPPED, spec, localPort(), null));
        }
    }
}
