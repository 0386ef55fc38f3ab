package com.questrail.echoprobe.scan;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test prober returning canned results per port.
 *
 * <p>Ports without a scripted result fail with "Connection refused". Every
 * probe is recorded in call order.</p>
 */
public final class ScriptedPortProber implements PortProber {

    private final Map<Integer, ProbeResult> results = new HashMap<>();
    private final List<Integer> probed = new ArrayList<>();

    public ScriptedPortProber open(int port) {
        results.put(port, new ProbeResult.Open(new byte[0]));
        return this;
    }

    public ScriptedPortProber openWithBanner(int port, byte[] banner) {
        results.put(port, new ProbeResult.Open(banner));
        return this;
    }

    @Override
    public synchronized ProbeResult probe(String host, int port, Duration connectTimeout, Duration readTimeout) {
        probed.add(port);
        return results.getOrDefault(port, new ProbeResult.ConnectFailed("Connection refused"));
    }

    public synchronized List<Integer> probedPorts() {
        return Collections.unmodifiableList(new ArrayList<>(probed));
    }
}
