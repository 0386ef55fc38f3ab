package com.questrail.echoprobe.scan;

import com.questrail.echoprobe.config.EchoProbeConfig;

/**
 * Starts a scan of a target without waiting for it.
 */
@FunctionalInterface
public interface ScanTrigger {
    /**
     * Start scanning {@code targetIp} in the background and return immediately.
     * The outcome is reported only through logs.
     */
    void trigger(String targetIp, EchoProbeConfig config);
}
