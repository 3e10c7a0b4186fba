/**
 * Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (blocking {@code java.net}
 * sockets, Netty, or an in-memory pipe in tests) and the connection layer.
 *
 * <h2>Why these ports exist</h2>
 * The connection handler and the listener only need three capabilities:
 * <ul>
 *   <li>{@link com.questrail.courier.transport.StreamSource}: blocking read,
 *       whole-frame write, close</li>
 *   <li>{@link com.questrail.courier.transport.Acceptor}: bind, blocking accept,
 *       stop</li>
 *   <li>{@link com.questrail.courier.transport.StreamTransport}: factory for
 *       acceptors and outbound streams</li>
 * </ul>
 *
 * <p>Keeping them this small means the connection state machine and the
 * accept loop can be tested without real networking, and that framework types
 * never leak above the transport package that uses them.</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no framing, no decoding)</li>
 *   <li>Report a configured read timeout as {@link java.net.SocketTimeoutException}</li>
 *   <li>Unblock a pending read or accept promptly when closed or stopped</li>
 * </ul>
 */
package com.questrail.courier.transport;
