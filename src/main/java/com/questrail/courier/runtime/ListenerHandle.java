package com.questrail.courier.runtime;

import com.questrail.courier.model.Endpoint;

import java.time.Duration;

/**
 * Caller-facing handle for a running listener.
 */
public interface ListenerHandle extends AutoCloseable
{
    /**
     * @return the bound endpoint, with the real port if 0 was requested
     */
    Endpoint localEndpoint();

    /**
     * Stop accepting and close every connection accepted by this listener.
     *
     * <p>Idempotent and safe to call from any thread, including concurrently
     * with an accept in progress. A blocked accept returns promptly.</p>
     */
    void stop();

    boolean isStopped();

    /**
     * Wait for the accept loop to exit after {@link #stop()}.
     *
     * @return true if the accept loop exited within {@code timeout}
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * @return number of accepted connections that are still open
     */
    int connectionCount();

    @Override
    default void close() {
        stop();
    }
}
