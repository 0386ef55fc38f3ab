package com.questrail.echoprobe.transport.tcp.netty;

/**
 * User event fired down a connection's pipeline when the binder shuts down
 * while the connection is still open.
 */
enum TransportShutdownEvent
{
    INSTANCE
}
