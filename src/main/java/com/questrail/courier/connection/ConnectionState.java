package com.questrail.courier.connection;

/**
 * Lifecycle of one connection.
 *
 * <pre>
 *   OPEN → READING → DISPATCHING → READING → ... → CLOSED
 * </pre>
 *
 * <p>{@link #CLOSED} is reachable from every state and is terminal.</p>
 */
public enum ConnectionState
{
    /** Created, worker not yet reading. Sends are already allowed. */
    OPEN,

    /** Worker is blocked decoding the next frame. */
    READING,

    /** Worker is running the application callback for a decoded frame. */
    DISPATCHING,

    /** Stream released. Sends fail with {@code ConnectionClosedException}. */
    CLOSED
}
