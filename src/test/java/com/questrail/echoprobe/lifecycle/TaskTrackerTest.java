package com.questrail.echoprobe.lifecycle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class TaskTrackerTest {

    @Test
    void countsPerKindAndInTotal() {
        TaskTracker tracker = new TaskTracker();

        TaskTracker.Registration c1 = tracker.begin(TaskTracker.Kind.CONNECTION);
        TaskTracker.Registration c2 = tracker.begin(TaskTracker.Kind.CONNECTION);
        TaskTracker.Registration s1 = tracker.begin(TaskTracker.Kind.SCAN);

        assertEquals(3, tracker.inFlight());
        assertEquals(2, tracker.inFlight(TaskTracker.Kind.CONNECTION));
        assertEquals(1, tracker.inFlight(TaskTracker.Kind.SCAN));

        c1.end();
        s1.end();

        assertEquals(1, tracker.inFlight());
        assertEquals(0, tracker.inFlight(TaskTracker.Kind.SCAN));
        c2.end();
        assertEquals(0, tracker.inFlight());
    }

    @Test
    void endIsIdempotent() {
        TaskTracker tracker = new TaskTracker();
        TaskTracker.Registration r = tracker.begin(TaskTracker.Kind.SCAN);
        tracker.begin(TaskTracker.Kind.SCAN);

        r.end();
        r.end();

        assertEquals(1, tracker.inFlight(TaskTracker.Kind.SCAN));
    }

    @Test
    void awaitDrainTimesOutWhileTasksRemain() throws Exception {
        TaskTracker tracker = new TaskTracker();
        tracker.begin(TaskTracker.Kind.CONNECTION);

        assertFalse(tracker.awaitDrain(Duration.ofMillis(50)));
        assertFalse(tracker.awaitDrain(Duration.ZERO));
    }

    @Test
    void awaitDrainReturnsOnceLastTaskEnds() throws Exception {
        TaskTracker tracker = new TaskTracker();
        TaskTracker.Registration r = tracker.begin(TaskTracker.Kind.SCAN);

        Thread ender = new Thread(() -> {
            try {
                TimeUnit.MILLISECONDS.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            r.end();
        });
        ender.start();

        assertTrue(tracker.awaitDrain(Duration.ofSeconds(5)));
        ender.join(2000);
    }

    @Test
    void emptyTrackerIsDrained() throws Exception {
        assertTrue(new TaskTracker().awaitDrain(Duration.ZERO));
    }
}
