package com.questrail.echoprobe.session;

import com.questrail.echoprobe.time.WallClock;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * SessionLog
 * =============================================================================
 * Line-oriented text log owned by one connection or one scan.
 *
 * <p>Each entry is written as a single line and flushed immediately:</p>
 * <pre>
 *   2026-10-19T08:15:30.123Z [INFO] Connection from: 10.0.0.7:51514
 * </pre>
 *
 * <p>Two sessions for the same peer may append to the same file concurrently;
 * whole-line writes keep their entries from corrupting each other.</p>
 */
public final class SessionLog implements Closeable {

    public enum Level {
        INFO,
        WARN,
        ERROR
    }

    private final Path path;
    private final Writer writer;
    private final WallClock clock;

    private SessionLog(Path path, Writer writer, WallClock clock) {
        this.path = path;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Opens {@code path} for appending, creating it if absent.
     */
    public static SessionLog append(Path path, WallClock clock) throws IOException {
        return open(path, clock, StandardOpenOption.APPEND);
    }

    /**
     * Opens {@code path} empty, discarding any previous content.
     */
    public static SessionLog truncate(Path path, WallClock clock) throws IOException {
        return open(path, clock, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static SessionLog open(Path path, WallClock clock, StandardOpenOption mode) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(clock, "clock");
        Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode);
        return new SessionLog(path, writer, clock);
    }

    public Path path() {
        return path;
    }

    public void info(String message) throws IOException {
        write(Level.INFO, message);
    }

    public void warn(String message) throws IOException {
        write(Level.WARN, message);
    }

    public void error(String message) throws IOException {
        write(Level.ERROR, message);
    }

    public synchronized void write(Level level, String message) throws IOException {
        String line = clock.now() + " [" + level + "] " + message + System.lineSeparator();
        writer.write(line);
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
