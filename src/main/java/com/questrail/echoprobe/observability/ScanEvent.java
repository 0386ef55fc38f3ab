package com.questrail.echoprobe.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing progress of a scan against one target.
 *
 * @param timestamp when the event occurred
 * @param kind      what happened
 * @param target    the scanned address
 * @param port      the probed port, or {@code -1} for scan-wide events
 * @param detail    human-readable detail (banner text, failure reason, rejected spec); may be empty
 */
public record ScanEvent(
    Instant timestamp,
    Kind kind,
    String target,
    int port,
    String detail
) {
    public enum Kind {
        DISABLED,
        SPEC_SKIPPED,
        STARTED,
        PORT_OPEN,
        DATA_RECEIVED,
        NO_DATA,
        CONNECT_FAILED,
        COMPLETED
    }

    public ScanEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        detail = detail == null ? "" : detail;
    }
}
