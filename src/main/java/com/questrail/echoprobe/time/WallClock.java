package com.questrail.echoprobe.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for human-readable timestamps in session logs and
 * observability events.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * Inactivity and probe timeouts are enforced by the transport and do not
 * consult it.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
