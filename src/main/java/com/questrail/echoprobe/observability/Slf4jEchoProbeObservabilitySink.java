package com.questrail.echoprobe.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EchoProbeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEchoProbeObservabilitySink implements EchoProbeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEchoProbeObservabilitySink.class);

    @Override
    public void onListenerEvent(ListenerEvent event) {
        switch (event.kind()) {
            case BOUND -> log.info("Listening on port {}", event.port());
            case BIND_FAILED -> log.error("Failed to listen on port {}: {}", event.port(), describe(event.cause()));
            case SPEC_REJECTED -> log.error("Invalid port specification: {} ({})", event.spec(), describe(event.cause()));
            case SPEC_EMPTY -> log.warn("Port specification {} resolves to no ports", event.spec());
            case STOPPED -> log.info("Shutdown signal for listener on port {} received", event.port());
            case ALL_STOPPED -> log.info("Shutdown signal received, stopping all listeners.");
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.kind()) {
            case ACCEPTED -> log.info("Accepted connection from: {}", event.peer());
            case DATA_ECHOED -> log.debug("Echoed {} bytes to {}", event.byteCount(), event.peer());
            case PEER_CLOSED -> log.info("Connection from {} closed by client", event.peer());
            case TIMED_OUT -> log.info("Connection from {} timed out due to inactivity", event.peer());
            case CLOSED_AT_SHUTDOWN -> log.info("Connection from {} closed at shutdown", event.peer());
            case DROPPED -> log.warn("Failed to process connection from {}: {}", event.peer(), describe(event.cause()));
        }
    }

    @Override
    public void onScanEvent(ScanEvent event) {
        switch (event.kind()) {
            case DISABLED -> log.info("Port scanning is disabled.");
            case SPEC_SKIPPED -> log.warn("Skipping scan port specification {} for {}", event.detail(), event.target());
            case STARTED -> log.info("Initiating port scan for: {}", event.target());
            case PORT_OPEN -> log.info("Port {} is open on {}", event.port(), event.target());
            case DATA_RECEIVED -> log.info("Received data from port {} on {}: {}", event.port(), event.target(), event.detail());
            case NO_DATA -> log.debug("No immediate data from port {} on {}", event.port(), event.target());
            case CONNECT_FAILED -> log.debug("Failed to connect to port {} on {}: {}", event.port(), event.target(), event.detail());
            case COMPLETED -> log.info("Port scan for {} complete: {}", event.target(), event.detail());
        }
    }

    @Override
    public void onError(EchoProbeErrorEvent event) {
        if (event.cause() == null) {
            log.error("{}", event.message());
        } else {
            log.error("{}", event.message(), event.cause());
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
