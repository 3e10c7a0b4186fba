package com.questrail.courier.connection;

import com.questrail.courier.error.MessagingException;
import com.questrail.courier.model.Message;

import java.util.Optional;

/**
 * Application callback for inbound messages.
 *
 * <p>All callbacks for one connection run on that connection's worker, one at
 * a time, in frame arrival order. Callbacks for different connections may run
 * concurrently. A {@link RuntimeException} thrown by {@link #onMessage} is
 * reported and does not close the connection.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    /**
     * Called once per successfully decoded frame.
     *
     * @param message    the decoded message
     * @param connection the connection it arrived on; {@link Connection#peer()}
     *                   identifies the sender
     */
    void onMessage(Message message, Connection connection);

    /**
     * Called exactly once when the connection reaches
     * {@link ConnectionState#CLOSED}.
     *
     * @param cause empty for a clean peer disconnect or a local close;
     *              otherwise the protocol, timeout or transport error that
     *              closed the connection
     */
    default void onClosed(Connection connection, Optional<MessagingException> cause) {}

    /**
     * Handler that ignores every message; for send-only clients.
     */
    static MessageHandler ignoring() {
        return (message, connection) -> {};
    }
}
