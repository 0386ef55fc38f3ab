package com.questrail.echoprobe.observability;

import java.time.Instant;

/**
 * Record representing an error that ended a scan or a background task.
 */
public record EchoProbeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
