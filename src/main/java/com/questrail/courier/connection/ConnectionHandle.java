package com.questrail.courier.connection;

import com.questrail.courier.model.Message;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing handle for a connection, adding request/reply on top of
 * one-way {@link #send(Message)}.
 *
 * <h2>Reply matching</h2>
 * <p>A reply is simply the next inbound message on the connection. Pending
 * requests are matched first-in first-out in the order their frames were
 * written, so this only works with a peer that answers every request, in
 * order, on the same connection. Messages consumed as replies are not
 * delivered to the {@link MessageHandler}.</p>
 *
 * <p>Never wait for a reply from inside a {@link MessageHandler} callback of
 * the same connection: the callback runs on the thread that reads replies.</p>
 */
public interface ConnectionHandle extends Connection
{
    /**
     * Send {@code message} and return a future completed with the reply.
     *
     * <p>The future fails with the close cause (or
     * {@link com.questrail.courier.error.ConnectionClosedException}) if the
     * connection closes first.</p>
     */
    CompletableFuture<Message> request(Message message);

    /**
     * Send {@code message} and block for the reply.
     *
     * @throws com.questrail.courier.error.ReadTimeoutException if no reply arrived in time;
     *         the connection stays open and a late reply is discarded
     * @throws InterruptedException if interrupted while waiting
     */
    Message request(Message message, Duration timeout) throws InterruptedException;
}
