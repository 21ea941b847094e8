/**
 * Suntech Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP, a simulator, or a test double) and the decode/aggregate
 * pipeline.</p>
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>raw frames as {@code byte[]}</li>
 *   <li>peers as standard {@link java.net.SocketAddress}</li>
 *   <li>listener and connection lifecycle notifications</li>
 * </ul>
 *
 * <p>Implementations of these ports perform transport I/O only. They never
 * decode frames or touch session state.</p>
 */
package com.questrail.tracker.protocol.suntech.transport;
