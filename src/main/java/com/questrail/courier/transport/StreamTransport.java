package com.questrail.courier.transport;

import com.questrail.courier.config.EndpointConfig;

import java.io.IOException;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Factory for the two transport ports. One transport instance may back any
 * number of acceptors and outbound streams; closing it releases shared
 * resources such as event loops.
 */
public interface StreamTransport extends AutoCloseable
{
    /**
     * @return a new, unbound acceptor
     */
    Acceptor newAcceptor();

    /**
     * Open an outbound stream. The configuration's read timeout applies to
     * the returned stream.
     */
    StreamSource connect(EndpointConfig config) throws IOException;

    @Override
    void close();
}
