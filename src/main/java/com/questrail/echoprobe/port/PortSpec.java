package com.questrail.echoprobe.port;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * PortSpec
 * -----------------------------------------------------------------------------
 * A parsed port specification: either a single port or an inclusive range.
 *
 * <p>Both bounds are always within {@code [0, 65535]}. A range whose start is
 * greater than its end is legal and resolves to no ports.</p>
 */
public record PortSpec(int start, int end) {

    public static final int MIN_PORT = 0;
    public static final int MAX_PORT = 65_535;

    /**
     * Highest port number that requires elevated privilege to bind or probe on
     * Unix-like systems.
     */
    public static final int PRIVILEGED_CEILING = 1024;

    public PortSpec {
        if (start < MIN_PORT || start > MAX_PORT) {
            throw new IllegalArgumentException("start out of range: " + start);
        }
        if (end < MIN_PORT || end > MAX_PORT) {
            throw new IllegalArgumentException("end out of range: " + end);
        }
    }

    public static PortSpec single(int port) {
        return new PortSpec(port, port);
    }

    public boolean isSingle() {
        return start == end;
    }

    public boolean isEmpty() {
        return start > end;
    }

    /**
     * Expands this range to concrete ports in ascending order.
     */
    public List<Integer> ports() {
        if (isEmpty()) {
            return List.of();
        }
        return IntStream.rangeClosed(start, end).boxed().collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return isSingle() ? Integer.toString(start) : start + "-" + end;
    }
}
