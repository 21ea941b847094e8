package com.questrail.tracker.protocol.suntech.transport;

import java.net.SocketAddress;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one connection are serialized and arrive in receipt order.
 * Callbacks for different connections may run concurrently, so implementations
 * must be thread-safe.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called once the listening socket is bound.
     *
     * @param localAddress the bound address
     */
    void onTransportUp(SocketAddress localAddress);

    /**
     * Called when the listening socket becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    void onConnectionOpened(SocketAddress remote);

    /**
     * Called before a connection is closed for inactivity.
     */
    void onConnectionIdle(SocketAddress remote);

    /**
     * @param cause the I/O failure that closed the connection; {@code null} when
     *              the peer disconnected or the connection timed out
     */
    void onConnectionClosed(SocketAddress remote, Throwable cause);

    /**
     * Called with the bytes of one socket read.
     *
     * <p>The payload is a private copy. No reassembly across reads is done: the
     * listener MUST treat it as one complete frame.</p>
     *
     * @param remote peer the bytes arrived from
     * @param frame  raw bytes, never empty
     */
    void onFrame(SocketAddress remote, byte[] frame);
}
