package com.questrail.echoprobe.scan;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.lifecycle.TaskTracker;
import com.questrail.echoprobe.observability.EchoProbeErrorEvent;
import com.questrail.echoprobe.observability.EchoProbeObservabilitySink;
import com.questrail.echoprobe.time.WallClock;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ScanLauncher
 * =============================================================================
 * Runs each {@link ScanEngine#scan} on its own background thread.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Unbounded: every trigger gets a thread immediately; nothing throttles
 *       concurrent scans across peers.</li>
 *   <li>Scan threads are daemons, so a scan in progress never holds the
 *       process open after shutdown.</li>
 *   <li>{@link #close()} stops new scans but does not interrupt running ones.
 *       {@link #close(Runnable)} additionally runs a release action once the
 *       last running scan has finished, so resources the scans depend on
 *       outlive them.</li>
 * </ul>
 *
 * <p>Each scan is registered with the {@link TaskTracker} for its duration.</p>
 */
public final class ScanLauncher implements ScanTrigger, AutoCloseable {

    private final ScanEngine engine;
    private final ExecutorService executor;
    private final TaskTracker tracker;
    private final EchoProbeObservabilitySink sink;
    private final WallClock clock;

    private int running;
    private boolean closed;
    private Runnable afterLastScan;

    public ScanLauncher(ScanEngine engine,
                        TaskTracker tracker,
                        EchoProbeObservabilitySink sink,
                        WallClock clock) {
        this(engine, Executors.newCachedThreadPool(new ScanThreadFactory()), tracker, sink, clock);
    }

    public ScanLauncher(ScanEngine engine,
                        ExecutorService executor,
                        TaskTracker tracker,
                        EchoProbeObservabilitySink sink,
                        WallClock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void trigger(String targetIp, EchoProbeConfig config) {
        Objects.requireNonNull(targetIp, "targetIp");
        Objects.requireNonNull(config, "config");

        synchronized (this) {
            if (closed) {
                sink.onError(new EchoProbeErrorEvent(clock.now(),
                    "Port scan of " + targetIp + " not started: launcher is shut down", null));
                return;
            }
            running++;
        }

        TaskTracker.Registration registration = tracker.begin(TaskTracker.Kind.SCAN);
        try {
            executor.execute(() -> {
                try {
                    engine.scan(targetIp, config);
                } catch (RuntimeException e) {
                    sink.onError(new EchoProbeErrorEvent(clock.now(), "Port scan of " + targetIp + " failed", e));
                } finally {
                    registration.end();
                    scanEnded();
                }
            });
        } catch (RejectedExecutionException e) {
            registration.end();
            scanEnded();
            sink.onError(new EchoProbeErrorEvent(clock.now(),
                "Port scan of " + targetIp + " not started: launcher is shut down", e));
        }
    }

    /**
     * Stops accepting new scans. Running scans continue.
     */
    @Override
    public void close() {
        close(() -> { });
    }

    /**
     * Stops accepting new scans and runs {@code afterLastScan} once no scan is
     * running: immediately if none is, otherwise on the thread of the last
     * scan to finish. Only the first call has any effect.
     */
    public void close(Runnable afterLastScan) {
        Objects.requireNonNull(afterLastScan, "afterLastScan");
        final boolean idle;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            idle = running == 0;
            if (!idle) {
                this.afterLastScan = afterLastScan;
            }
        }
        executor.shutdown();
        if (idle) {
            afterLastScan.run();
        }
    }

    private void scanEnded() {
        final Runnable release;
        synchronized (this) {
            running--;
            if (!closed || running > 0 || afterLastScan == null) {
                return;
            }
            release = afterLastScan;
            afterLastScan = null;
        }
        try {
            release.run();
        } catch (RuntimeException e) {
            sink.onError(new EchoProbeErrorEvent(clock.now(), "Failed to release scan resources", e));
        }
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "echoprobe-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
