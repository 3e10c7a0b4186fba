/**
 * Listener/Dispatcher and composition root.
 *
 * <p>{@link com.questrail.courier.runtime.Messaging} wires a transport, the
 * codec, the observability sink and a worker pool together and exposes the
 * two roles: {@code listen(...)} returning a
 * {@link com.questrail.courier.runtime.ListenerHandle}, and
 * {@code connect(...)} returning a
 * {@link com.questrail.courier.connection.ConnectionHandle}.</p>
 */
package com.questrail.courier.runtime;
