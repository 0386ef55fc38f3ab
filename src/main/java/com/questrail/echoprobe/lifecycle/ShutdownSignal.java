package com.questrail.echoprobe.lifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * ShutdownSignal
 * =============================================================================
 * Process-wide, one-way broadcast used to stop accepting connections.
 *
 * <h2>States</h2>
 * <pre>
 *   OPEN  --close()-->  CLOSED
 * </pre>
 * The transition happens at most once and cannot be undone.
 *
 * <h2>Observers</h2>
 * Accept loops register a callback with {@link #onClose(Runnable)}; callbacks
 * run once, on the thread that calls {@link #close()}. A callback registered
 * after closure runs immediately on the registering thread.
 *
 * <p>In-flight connections and scans never observe this signal.</p>
 */
public final class ShutdownSignal {

    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean closed;

    /**
     * Closes the signal and runs every registered callback.
     * Idempotent: later calls return without doing anything.
     *
     * <p>If a callback throws, the remaining callbacks still run and the first
     * failure is rethrown afterwards with later ones attached as suppressed.</p>
     */
    public void close() {
        final List<Runnable> toRun;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        closedLatch.countDown();

        RuntimeException failure = null;
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Registers a callback to run when the signal closes.
     */
    public void onClose(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (this) {
            if (!closed) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * Blocks until the signal closes.
     */
    public void awaitClosed() throws InterruptedException {
        closedLatch.await();
    }

    /**
     * Blocks until the signal closes or the timeout elapses.
     *
     * @return {@code true} if the signal is closed
     */
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
