package com.questrail.echoprobe.transport;

/**
 * BoundListener
 * -----------------------------------------------------------------------------
 * A successfully bound listening socket.
 */
public interface BoundListener
{
    /**
     * Port the listener is actually bound to (differs from the requested port
     * only when {@code 0} was requested).
     */
    int localPort();

    boolean isOpen();

    /**
     * Stop accepting and unbind the port.
     *
     * <p>Returns once the socket is closed so that later connection attempts
     * are refused. Connections already accepted are left running.</p>
     */
    void close();
}
