package com.questrail.echoprobe.observability;

/**
 * Main interface for receiving echoprobe observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from listener, connection and scan threads concurrently;
 * implementations must be thread-safe.</p>
 */
public interface EchoProbeObservabilitySink {
    /**
     * Called when a listener binds, fails to bind, rejects a spec, or stops.
     * @param event the listener event
     */
    void onListenerEvent(ListenerEvent event);

    /**
     * Called at each step of an accepted connection's lifecycle.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called as a scan of a peer progresses.
     * @param event the scan event
     */
    void onScanEvent(ScanEvent event);

    /**
     * Called when an error aborts a scan or escapes a background task.
     * @param event the error event
     */
    void onError(EchoProbeErrorEvent event);
}
