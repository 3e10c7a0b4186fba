package com.questrail.courier.connection;

import com.questrail.courier.model.Endpoint;
import com.questrail.courier.model.Message;

/**
 * One live, bidirectional message stream to a peer.
 *
 * <p>Handed to {@link MessageHandler} callbacks so that a handler can identify
 * the peer and reply on the same connection.</p>
 */
public interface Connection
{
    /**
     * @return the remote endpoint
     */
    Endpoint peer();

    Endpoint localEndpoint();

    Direction direction();

    ConnectionState state();

    default boolean isOpen() {
        return state() != ConnectionState.CLOSED;
    }

    /**
     * Encode and write one message as a single frame.
     *
     * <p>Safe to call from any thread; concurrent sends on the same connection
     * are serialized and their frames never interleave.</p>
     *
     * @throws com.questrail.courier.error.ConnectionClosedException if the connection is closed
     * @throws com.questrail.courier.error.PayloadTooLargeException if the message does not fit
     *         the wire format; the connection stays usable
     * @throws com.questrail.courier.error.TransportException if the write fails; the
     *         connection is closed
     */
    void send(Message message);

    /**
     * Close the connection. Idempotent. Unblocks the worker if it is waiting
     * for a frame.
     */
    void close();
}
