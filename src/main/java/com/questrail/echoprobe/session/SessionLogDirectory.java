package com.questrail.echoprobe.session;

import com.questrail.echoprobe.time.WallClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves and opens the per-peer and per-scan log files under one directory.
 *
 * <ul>
 *   <li>{@code <dir>/<peer-ip>.log} - connection lifecycle and traffic, appended</li>
 *   <li>{@code <dir>/<target-ip>-scan.log} - scan outcomes, rewritten per scan</li>
 * </ul>
 *
 * The directory is created on first use.
 */
public final class SessionLogDirectory {

    private final Path root;
    private final WallClock clock;

    public SessionLogDirectory(Path root, WallClock clock) {
        this.root = Objects.requireNonNull(root, "root");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path root() {
        return root;
    }

    public Path peerLogPath(String peerIp) {
        return root.resolve(fileSafe(peerIp) + ".log");
    }

    public Path scanLogPath(String targetIp) {
        return root.resolve(fileSafe(targetIp) + "-scan.log");
    }

    public SessionLog openPeerLog(String peerIp) throws IOException {
        Files.createDirectories(root);
        return SessionLog.append(peerLogPath(peerIp), clock);
    }

    public SessionLog openScanLog(String targetIp) throws IOException {
        Files.createDirectories(root);
        return SessionLog.truncate(scanLogPath(targetIp), clock);
    }

    // IPv6 scope ids ("fe80::1%eth0") are kept; only path separators are unsafe.
    private static String fileSafe(String ip) {
        Objects.requireNonNull(ip, "ip");
        return ip.replace('/', '_').replace('\\', '_');
    }
}
