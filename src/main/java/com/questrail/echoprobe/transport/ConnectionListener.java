package com.questrail.echoprobe.transport;

import java.io.IOException;
import java.net.SocketAddress;

/**
 * ConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for one accepted TCP connection.
 *
 * <p>The transport delivers callbacks for a connection serially. After
 * {@link #onOpen} returns {@code true}, exactly one of {@link #onPeerClosed()},
 * {@link #onIdleTimeout()}, {@link #onTransportShutdown()} or
 * {@link #onFailure(Throwable)} follows, and no callback is delivered after
 * it.</p>
 */
public interface ConnectionListener
{
    /**
     * Called once when the connection is accepted.
     *
     * @param remote remote endpoint as reported by the socket; may be {@code null}
     *               if the transport cannot determine it
     * @return {@code false} to have the transport close the connection quietly,
     *         with no further callbacks
     */
    boolean onOpen(SocketAddress remote);

    /**
     * Called for each chunk read from the peer.
     *
     * <p>The returned bytes are written back in full before the next read is
     * issued. A write that cannot complete ends the connection through
     * {@link #onFailure(Throwable)}.</p>
     *
     * @param payload bytes received, never empty
     * @return bytes to send back to the peer
     * @throws IOException to end the connection as failed
     */
    byte[] onData(byte[] payload) throws IOException;

    /**
     * The peer closed its side of the connection.
     */
    void onPeerClosed();

    /**
     * No data arrived within the configured inactivity timeout; the transport
     * closes the connection after this returns.
     */
    void onIdleTimeout();

    /**
     * The transport is shutting down and closes the connection after this
     * returns. The peer has not closed its side.
     */
    void onTransportShutdown();

    /**
     * A read or write failed; the transport closes the connection after this
     * returns.
     */
    void onFailure(Throwable cause);
}
