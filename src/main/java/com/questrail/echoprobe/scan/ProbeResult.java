package com.questrail.echoprobe.scan;

import java.util.Objects;

/**
 * Outcome of probing one port.
 */
public sealed interface ProbeResult permits ProbeResult.Open, ProbeResult.ConnectFailed {

    /**
     * The connect succeeded.
     *
     * @param banner bytes the service sent unprompted within the read bound;
     *               empty if nothing arrived
     */
    record Open(byte[] banner) implements ProbeResult {
        public Open {
            Objects.requireNonNull(banner, "banner");
        }

        public boolean hasBanner() {
            return banner.length > 0;
        }
    }

    /**
     * The connect failed.
     *
     * @param reason human-readable failure reason
     */
    record ConnectFailed(String reason) implements ProbeResult {
        public ConnectFailed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
