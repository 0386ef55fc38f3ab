package com.questrail.echoprobe.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a change in the set of bound listeners.
 *
 * @param timestamp when the event occurred
 * @param kind      what happened
 * @param spec      the port spec text being processed
 * @param port      the concrete port, or {@code -1} when the event concerns the whole port spec
 * @param cause     failure cause for {@link Kind#BIND_FAILED} and {@link Kind#SPEC_REJECTED}; otherwise {@code null}
 */
public record ListenerEvent(
    Instant timestamp,
    Kind kind,
    String spec,
    int port,
    Throwable cause
) {
    public enum Kind {
        BOUND,
        BIND_FAILED,
        SPEC_REJECTED,
        SPEC_EMPTY,
        STOPPED,
        ALL_STOPPED
    }

    public ListenerEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }
}
