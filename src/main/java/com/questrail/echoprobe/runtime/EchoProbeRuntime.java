package com.questrail.echoprobe.runtime;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.lifecycle.ShutdownSignal;
import com.questrail.echoprobe.lifecycle.TaskTracker;
import com.questrail.echoprobe.listener.ListenerHandle;
import com.questrail.echoprobe.listener.ListenerManager;
import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.observability.NullObservabilitySink;
import com.questrail.echoprobe.port.PortSpecParser;
import com.questrail.echoprobe.scan.PortProber;
import com.questrail.echoprobe.scan.PrivilegeCheck;
import com.questrail.echoprobe.scan.PrivilegeChecks;
import com.questrail.echoprobe.scan.ScanEngine;
import com.questrail.echoprobe.scan.ScanLauncher;
import com.questrail.echoprobe.session.ConnectionSession;
import com.questrail.echoprobe.session.SessionLogDirectory;
import com.questrail.echoprobe.time.SystemWallClock;
import com.questrail.echoprobe.time.WallClock;
import com.questrail.echoprobe.transport.TcpListenerBinder;
import com.questrail.echoprobe.transport.tcp.netty.NettyPortProber;
import com.questrail.echoprobe.transport.tcp.netty.NettyTcpListenerBinder;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EchoProbeRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for the listener, session and
 * scan stack.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   run()     → bind listeners, block until the shutdown signal closes, release
 *   start()   → bind listeners and return (embedding and tests)
 *   stop()    → close the shutdown signal, then release
 * </pre>
 *
 * <h2>Release</h2>
 * Listeners close the moment the shutdown signal closes. Release then waits up
 * to {@link EchoProbeConfig#shutdownDrainTimeout()} for connections and scans
 * still in flight, and finally shuts the transports down. With the default
 * drain timeout of zero nothing is awaited: connections still open are closed
 * with the transport (and logged as closed at shutdown) while scans continue
 * on daemon threads until they finish or the process exits. An owned prober
 * stays up until the last running scan has finished.
 */
public final class EchoProbeRuntime {

    private final EchoProbeConfig config;
    private final ListenerManager listenerManager;
    private final TcpListenerBinder binder;
    private final ScanLauncher scanLauncher;
    private final NettyPortProber ownedProber;
    private final TaskTracker tracker;
    private final ShutdownSignal shutdown;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile int leftRunning;

    private EchoProbeRuntime(EchoProbeConfig config,
                             ListenerManager listenerManager,
                             TcpListenerBinder binder,
                             ScanLauncher scanLauncher,
                             NettyPortProber ownedProber,
                             TaskTracker tracker,
                             ShutdownSignal shutdown) {
        this.config = config;
        this.listenerManager = listenerManager;
        this.binder = binder;
        this.scanLauncher = scanLauncher;
        this.ownedProber = ownedProber;
        this.tracker = tracker;
        this.shutdown = shutdown;
    }

    public EchoProbeConfig config() {
        return config;
    }

    public ShutdownSignal shutdownSignal() {
        return shutdown;
    }

    public TaskTracker tasks() {
        return tracker;
    }

    /**
     * Binds the listeners and blocks until the shutdown signal closes, then
     * releases all resources.
     *
     * @return number of connections and scans still running when release
     *         stopped waiting for them
     */
    public int run() {
        markStarted();
        listenerManager.run(config.listenPorts(), shutdown, config);
        return release();
    }

    /**
     * Binds the listeners and returns without waiting.
     */
    public List<ListenerHandle> start() {
        markStarted();
        return listenerManager.start(config.listenPorts(), shutdown, config);
    }

    /**
     * Closes the shutdown signal and releases all resources.
     *
     * @return number of connections and scans still running when release
     *         stopped waiting for them
     */
    public int stop() {
        shutdown.close();
        return release();
    }

    /**
     * Waits until {@link #run()} or {@link #stop()} has released everything.
     *
     * @return {@code true} if release finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void markStarted() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("EchoProbeRuntime already started");
        }
    }

    private int release() {
        if (!released.compareAndSet(false, true)) {
            return leftRunning;
        }

        try {
            if (!tracker.awaitDrain(config.shutdownDrainTimeout())) {
                leftRunning = tracker.inFlight();
            }
        } catch (InterruptedException e) {
            leftRunning = tracker.inFlight();
            Thread.currentThread().interrupt();
        }

        try {
            // Scans still running keep probing, so the prober is closed only
            // after the last of them finishes.
            scanLauncher.close(ownedProber != null ? ownedProber::close : () -> { });
            binder.shutdown();
        } finally {
            terminated.countDown();
        }
        return leftRunning;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EchoProbeConfig config;
        private EchoProbeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PrivilegeCheck privilegeCheck = PrivilegeChecks.forCurrentPlatform();
        private WallClock clock = SystemWallClock.INSTANCE;
        private TcpListenerBinder binder;
        private PortProber prober;
        private ShutdownSignal shutdown;

        public Builder withConfig(EchoProbeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(EchoProbeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withPrivilegeCheck(PrivilegeCheck check) {
            this.privilegeCheck = check;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Overrides the Netty listener binder. The runtime still shuts the
         * supplied binder down on release.
         */
        public Builder withListenerBinder(TcpListenerBinder binder) {
            this.binder = binder;
            return this;
        }

        /**
         * Overrides the Netty prober. A supplied prober is not closed by the
         * runtime.
         */
        public Builder withPortProber(PortProber prober) {
            this.prober = prober;
            return this;
        }

        public Builder withShutdownSignal(ShutdownSignal shutdown) {
            this.shutdown = shutdown;
            return this;
        }

        public EchoProbeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(privilegeCheck, "privilegeCheck");
            Objects.requireNonNull(clock, "clock");

            // 1. Shared infrastructure
            PortSpecParser parser = new PortSpecParser();
            TaskTracker tracker = new TaskTracker();
            ShutdownSignal signal = shutdown != null ? shutdown : new ShutdownSignal();
            SessionLogDirectory logs = new SessionLogDirectory(config.logDirectory(), clock);

            // 2. Scanning
            NettyPortProber ownedProber = null;
            PortProber effectiveProber = prober;
            if (effectiveProber == null) {
                ownedProber = new NettyPortProber();
                effectiveProber = ownedProber;
            }
            ScanEngine engine = new ScanEngine(parser, effectiveProber, privilegeCheck, logs, observabilitySink, clock);
            ScanLauncher launcher = new ScanLauncher(engine, tracker, observabilitySink, clock);

            // 3. Listening
            TcpListenerBinder effectiveBinder = binder != null
                ? binder
                : new NettyTcpListenerBinder(config.connectionTimeout());

            final EchoProbeObservabilitySink sink = observabilitySink;
            final WallClock wallClock = clock;
            ListenerManager manager = new ListenerManager(
                effectiveBinder,
                parser,
                cfg -> new ConnectionSession(cfg, logs, launcher, tracker, sink, wallClock),
                sink,
                wallClock
            );

            return new EchoProbeRuntime(config, manager, effectiveBinder, launcher, ownedProber, tracker, signal);
        }
    }
}
