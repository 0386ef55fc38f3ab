package com.questrail.echoprobe.scan;

import java.time.Duration;

/**
 * PortProber
 * -----------------------------------------------------------------------------
 * Port for a single connect-and-listen probe against one TCP port.
 *
 * <p>Implementations block the calling thread until the probe finishes and
 * never throw for network failures; those come back as
 * {@link ProbeResult.ConnectFailed}.</p>
 */
public interface PortProber
{
    /**
     * Connect to {@code host:port}; on success wait up to {@code readTimeout}
     * for the first chunk of unsolicited data, then disconnect.
     */
    ProbeResult probe(String host, int port, Duration connectTimeout, Duration readTimeout);
}
