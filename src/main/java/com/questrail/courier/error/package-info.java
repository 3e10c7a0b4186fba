/**
 * Messaging error taxonomy.
 *
 * <ul>
 *   <li>{@link com.questrail.courier.error.InvalidPayloadException}: message construction</li>
 *   <li>{@link com.questrail.courier.error.PayloadTooLargeException}: encode</li>
 *   <li>{@link com.questrail.courier.error.ProtocolException}: decode, closes the connection</li>
 *   <li>{@link com.questrail.courier.error.ReadTimeoutException}: read or request timeout</li>
 *   <li>{@link com.questrail.courier.error.ConnectionClosedException}: send on a closed connection</li>
 *   <li>{@link com.questrail.courier.error.TransportException}: I/O failure, closes the connection</li>
 * </ul>
 *
 * <p>No retry or reconnect logic lives in the core. Reconnecting after a
 * timeout or transport failure is the caller's decision.</p>
 */
package com.questrail.courier.error;
