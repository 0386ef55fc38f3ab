package com.questrail.echoprobe.port;

import java.util.List;

/**
 * PortSpecParser
 * =============================================================================
 * Turns textual port specifications ({@code "8080"}, {@code "8000-8010"}) into
 * concrete port numbers.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   spec  := port | port "-" port
 *   port  := decimal integer in [0, 65535]
 * </pre>
 *
 * <p>Surrounding whitespace on the whole spec and on each range bound is
 * ignored. Anything else is rejected with {@link MalformedPortSpecException};
 * nothing is ever silently defaulted to zero.</p>
 *
 * <h2>Inverted ranges</h2>
 * <p>{@code "9000-8000"} parses successfully and resolves to an empty list.
 * Callers treat that as a legitimate result, not an error.</p>
 *
 * <p>The parser is stateless and safe to share between threads.</p>
 */
public final class PortSpecParser {

    /**
     * Parses a specification without expanding it.
     *
     * @throws MalformedPortSpecException if the text is not a single port or a
     *                                    two-bound range
     */
    public PortSpec parse(String spec) throws MalformedPortSpecException {
        if (spec == null) {
            throw new MalformedPortSpecException("null", "Port specification is missing");
        }

        String text = spec.trim();
        if (text.isEmpty()) {
            throw new MalformedPortSpecException(spec, "Port specification is empty");
        }

        int dash = text.indexOf('-');
        if (dash < 0) {
            return PortSpec.single(parsePort(spec, text));
        }

        if (text.indexOf('-', dash + 1) >= 0) {
            throw new MalformedPortSpecException(spec, "Port range has more than one '-': " + spec);
        }

        int start = parsePort(spec, text.substring(0, dash).trim());
        int end = parsePort(spec, text.substring(dash + 1).trim());
        return new PortSpec(start, end);
    }

    /**
     * Parses and expands a specification into ascending port numbers.
     *
     * @return the resolved ports; empty for an inverted range
     * @throws MalformedPortSpecException if the text is malformed
     */
    public List<Integer> resolve(String spec) throws MalformedPortSpecException {
        return parse(spec).ports();
    }

    private static int parsePort(String spec, String digits) throws MalformedPortSpecException {
        if (digits.isEmpty()) {
            throw new MalformedPortSpecException(spec, "Port range is missing a bound: " + spec);
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedPortSpecException(spec, "Invalid port specification: " + spec);
            }
        }

        final int port;
        try {
            port = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedPortSpecException(spec, "Port out of range: " + spec, e);
        }

        if (port < PortSpec.MIN_PORT || port > PortSpec.MAX_PORT) {
            throw new MalformedPortSpecException(spec, "Port out of range: " + spec);
        }
        return port;
    }
}
