package com.questrail.echoprobe.observability;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a step in an echo connection's lifecycle.
 *
 * @param timestamp when the event occurred
 * @param kind      what happened
 * @param peer      remote endpoint of the connection
 * @param byteCount payload size for {@link Kind#DATA_ECHOED}; otherwise 0
 * @param cause     failure cause for {@link Kind#DROPPED}; otherwise {@code null}
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    InetSocketAddress peer,
    int byteCount,
    Throwable cause
) {
    public enum Kind {
        ACCEPTED,
        DATA_ECHOED,
        PEER_CLOSED,
        TIMED_OUT,
        CLOSED_AT_SHUTDOWN,
        DROPPED
    }

    public ConnectionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(peer, "peer");
    }

    /**
     * True when the connection ended with this event.
     */
    public boolean isTerminal() {
        return kind == Kind.PEER_CLOSED || kind == Kind.TIMED_OUT
            || kind == Kind.CLOSED_AT_SHUTDOWN || kind == Kind.DROPPED;
    }
}
