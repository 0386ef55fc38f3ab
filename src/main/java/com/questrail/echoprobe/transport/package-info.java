/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty NIO, a test double) and
 * the listener, session and scan logic.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Connection lifecycle callbacks (open, data, peer close, idle, failure)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no logging policy, no scanning decisions)</li>
 *   <li>Deliver the callbacks of one connection serially</li>
 *   <li>Deliver exactly one terminal callback per opened connection</li>
 * </ul>
 */
package com.questrail.echoprobe.transport;
