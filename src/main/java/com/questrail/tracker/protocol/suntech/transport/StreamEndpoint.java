package com.questrail.tracker.protocol.suntech.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a connection-oriented listener that accepts device
 * connections and delivers what each socket read returned as one frame.
 *
 * <p>The endpoint echoes every received frame back to its sender once the
 * listener has returned, whatever the listener did with it. Beyond that echo it
 * never invents outbound traffic.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Bind the listening socket and begin accepting connections.
     *
     * <p>Returns once the socket is bound. On success the listener is notified
     * via {@link StreamEndpointListener#onTransportUp(SocketAddress)}; on failure
     * via {@link StreamEndpointListener#onTransportDown(Throwable)} before an
     * {@link IllegalStateException} is thrown.</p>
     */
    void start();

    /**
     * Close the listening socket and every open connection, then release all
     * transport resources. Frames already being processed finish first.
     */
    void stop();

    /**
     * Register the listener that receives frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * The bound local address, once started.
     */
    Optional<SocketAddress> localAddress();
}
