package com.questrail.courier.transport.socket;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;
import com.questrail.courier.transport.StreamTransport;

import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * SocketStreamTransport
 * =============================================================================
 * {@link StreamTransport} backed by blocking {@code java.net} sockets. Holds
 * no shared resources, so {@link #close()} has nothing to release.
 */
public final class SocketStreamTransport implements StreamTransport
{
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration connectTimeout;

    public SocketStreamTransport()
    {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public SocketStreamTransport(Duration connectTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public Acceptor newAcceptor()
    {
        return new ServerSocketAcceptor();
    }

    @Override
    public StreamSource connect(EndpointConfig config) throws IOException
    {
        Objects.requireNonNull(config, "config");
        config.requireConnectable();

        Socket socket = new Socket();
        try {
            socket.connect(config.endpoint().toSocketAddress(), (int) connectTimeout.toMillis());
            return new SocketStreamSource(socket, config.readTimeoutMillis());
        }
        catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    @Override
    public void close()
    {
        // Stateless: every socket is owned by the stream that wraps it.
    }
}
