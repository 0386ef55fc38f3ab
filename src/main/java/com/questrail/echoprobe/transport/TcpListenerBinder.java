package com.questrail.echoprobe.transport;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * TcpListenerBinder
 * -----------------------------------------------------------------------------
 * Port for binding TCP listeners on all interfaces.
 *
 * <p>Each accepted connection is driven by a fresh {@link ConnectionListener}
 * obtained from the supplied factory. Accepting runs independently of the
 * connections it has already handed off.</p>
 */
public interface TcpListenerBinder
{
    /**
     * Bind a listener on the given port of every local interface.
     *
     * <p>Blocks until the bind has either succeeded or failed.</p>
     *
     * @param port      port to bind; {@code 0} picks an ephemeral port
     * @param listeners factory invoked once per accepted connection
     * @return handle to the bound listener
     * @throws IOException if the port cannot be bound
     */
    BoundListener bind(int port, Supplier<ConnectionListener> listeners) throws IOException;

    /**
     * Release all transport resources, including connections still open.
     */
    void shutdown();
}
