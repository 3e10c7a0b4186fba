/**
 * Blocking {@code java.net} socket implementation of the stream transport ports.
 *
 * <p>One platform thread blocks per read and per accept. Read timeouts map to
 * {@code SO_TIMEOUT}; closing a socket is what unblocks a pending read, and
 * closing the server socket is what unblocks a pending accept.</p>
 */
package com.questrail.courier.transport.socket;
