package com.questrail.echoprobe.port;

import java.util.Objects;

/**
 * Indicates that a textual port specification could not be resolved into
 * concrete port numbers.
 *
 * This typically reflects:
 * <ul>
 *   <li>Non-numeric text</li>
 *   <li>A value outside {@code [0, 65535]}</li>
 *   <li>A range with a missing bound or more than one {@code -}</li>
 * </ul>
 *
 * The offending text is preserved so callers can report it and move on to
 * sibling specifications.
 */
public final class MalformedPortSpecException extends Exception
{
    private final String spec;

    public MalformedPortSpecException(String spec, String message) {
        super(message);
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    public MalformedPortSpecException(String spec, String message, Throwable cause) {
        super(message, cause);
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    /**
     * The specification text exactly as it was supplied.
     */
    public String spec() {
        return spec;
    }
}
