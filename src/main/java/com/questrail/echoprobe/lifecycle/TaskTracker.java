package com.questrail.echoprobe.lifecycle;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TaskTracker
 * =============================================================================
 * Counts connection and scan tasks that are still running so shutdown can
 * decide how long to wait for them.
 *
 * <p>Tracking never cancels anything. Shutdown may stop waiting while tasks
 * are still in flight; {@link #inFlight()} reports how many were left behind.</p>
 */
public final class TaskTracker {

    public enum Kind {
        CONNECTION,
        SCAN
    }

    /**
     * Handle for one tracked task. {@link #end()} is idempotent.
     */
    public interface Registration {
        void end();
    }

    private final Map<Kind, Integer> counts = new EnumMap<>(Kind.class);
    private int total;

    public Registration begin(Kind kind) {
        Objects.requireNonNull(kind, "kind");
        synchronized (this) {
            counts.merge(kind, 1, Integer::sum);
            total++;
        }

        AtomicBoolean ended = new AtomicBoolean(false);
        return () -> {
            if (ended.compareAndSet(false, true)) {
                finish(kind);
            }
        };
    }

    private synchronized void finish(Kind kind) {
        counts.merge(kind, -1, Integer::sum);
        total--;
        if (total == 0) {
            notifyAll();
        }
    }

    public synchronized int inFlight() {
        return total;
    }

    public synchronized int inFlight(Kind kind) {
        return counts.getOrDefault(kind, 0);
    }

    /**
     * Waits until no tracked task is running or the timeout elapses.
     *
     * @return {@code true} if every tracked task has ended
     */
    public synchronized boolean awaitDrain(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (total > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }
}
