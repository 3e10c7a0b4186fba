package com.questrail.courier.transport;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.model.Endpoint;

import java.io.IOException;
import java.util.Optional;

/**
 * Acceptor
 * -----------------------------------------------------------------------------
 * Minimal port for the passive side of a stream transport.
 *
 * <p>Lifecycle is {@code bind → accept* → stop}. {@link #stop()} may be called
 * from any thread, including while another thread is blocked in
 * {@link #accept()}.</p>
 */
public interface Acceptor
{
    /**
     * Bind and start listening.
     *
     * <p>The configuration's read timeout applies to every stream accepted
     * afterwards.</p>
     *
     * @return the endpoint actually bound, with the real port when 0 was requested
     */
    Endpoint bind(EndpointConfig config) throws IOException;

    /**
     * Block until a peer connects or the acceptor is stopped.
     *
     * @return the accepted stream, or {@link Optional#empty()} once stopped
     * @throws IOException on an accept failure that does not stop the acceptor
     *         (for example, descriptor exhaustion)
     */
    Optional<StreamSource> accept() throws IOException;

    /**
     * Stop accepting and release the listening socket. Idempotent.
     * A thread blocked in {@link #accept()} returns empty promptly.
     */
    void stop();

    boolean isStopped();
}
