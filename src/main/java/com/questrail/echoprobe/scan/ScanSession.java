package com.questrail.echoprobe.scan;

import com.questrail.echoprobe.session.SessionLog;

import java.util.List;
import java.util.Objects;

/**
 * One pass over a target's resolved scan ports, together with the log that
 * records it. Created per scan, discarded once every port has been probed.
 */
final class ScanSession {

    private final String targetIp;
    private final List<Integer> ports;
    private final SessionLog log;

    private int probed;
    private int open;

    ScanSession(String targetIp, List<Integer> ports, SessionLog log) {
        this.targetIp = Objects.requireNonNull(targetIp, "targetIp");
        this.ports = List.copyOf(ports);
        this.log = Objects.requireNonNull(log, "log");
    }

    String targetIp() {
        return targetIp;
    }

    List<Integer> ports() {
        return ports;
    }

    SessionLog log() {
        return log;
    }

    void recordProbe(boolean portOpen) {
        probed++;
        if (portOpen) {
            open++;
        }
    }

    String summary() {
        return probed + " ports probed, " + open + " open";
    }
}
