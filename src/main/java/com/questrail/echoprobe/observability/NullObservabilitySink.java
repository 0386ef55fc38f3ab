package com.questrail.echoprobe.observability;

/**
 * No-op implementation of EchoProbeObservabilitySink.
 */
public final class NullObservabilitySink implements EchoProbeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onListenerEvent(ListenerEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onScanEvent(ScanEvent event) {}

    @Override
    public void onError(EchoProbeErrorEvent event) {}
}
