package com.questrail.echoprobe.listener;

import com.questrail.echoprobe.config.EchoProbeConfig;
import com.questrail.echoprobe.transport.ConnectionListener;

/**
 * Creates the per-connection handler for each accepted socket.
 */
@FunctionalInterface
public interface ConnectionListenerFactory {
    ConnectionListener newConnection(EchoProbeConfig config);
}
