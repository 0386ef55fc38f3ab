package com.questrail.echoprobe.session;

import com.questrail.echoprobe.time.ManualWallClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SessionLogTest {

    @TempDir
    Path dir;

    private final ManualWallClock clock = new ManualWallClock();

    @Test
    void linesCarryTimestampAndLevel() throws Exception {
        Path file = dir.resolve("peer.log");

        try (SessionLog log = SessionLog.append(file, clock)) {
            log.info("Connection from: 10.0.0.7:51514");
            clock.advance(Duration.ofSeconds(1));
            log.warn("Connection dropped after I/O error: reset");
            log.error("boom");
        }

        assertEquals(List.of(
                "2026-01-01T00:00:00Z [INFO] Connection from: 10.0.0.7:51514",
                "2026-01-01T00:00:01Z [WARN] Connection dropped after I/O error: reset",
                "2026-01-01T00:00:01Z [ERROR] boom"
        ), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void appendKeepsEarlierContent() throws Exception {
        Path file = dir.resolve("peer.log");
        try (SessionLog log = SessionLog.append(file, clock)) {
            log.info("first");
        }
        try (SessionLog log = SessionLog.append(file, clock)) {
            log.info("second");
        }

        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    void truncateDiscardsEarlierContent() throws Exception {
        Path file = dir.resolve("scan.log");
        try (SessionLog log = SessionLog.truncate(file, clock)) {
            log.info("old scan");
        }
        try (SessionLog log = SessionLog.truncate(file, clock)) {
            log.info("new scan");
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).endsWith("new scan"));
    }

    @Test
    void entriesAreVisibleBeforeClose() throws Exception {
        Path file = dir.resolve("live.log");
        try (SessionLog log = SessionLog.append(file, clock)) {
            log.info("flushed");

            assertEquals(1, Files.readAllLines(file).size());
        }
    }

    @Test
    void directoryNamesFilesAfterThePeer() throws Exception {
        SessionLogDirectory logs = new SessionLogDirectory(dir.resolve("nested/logs"), clock);

        assertEquals(dir.resolve("nested/logs/10.0.0.7.log"), logs.peerLogPath("10.0.0.7"));
        assertEquals(dir.resolve("nested/logs/10.0.0.7-scan.log"), logs.scanLogPath("10.0.0.7"));

        try (SessionLog log = logs.openPeerLog("::1")) {
            log.info("ipv6");
        }
        assertTrue(Files.exists(dir.resolve("nested/logs/::1.log")));
    }
}
