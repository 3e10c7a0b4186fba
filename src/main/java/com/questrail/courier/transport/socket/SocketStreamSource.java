package com.questrail.courier.transport.socket;

import com.questrail.courier.model.Endpoint;
import com.questrail.courier.transport.StreamSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SocketStreamSource
 * =============================================================================
 * {@link StreamSource} over a connected, blocking {@link Socket}.
 *
 * <p>Endpoints are captured at construction because a closed socket no
 * longer reports its remote address.</p>
 */
public final class SocketStreamSource implements StreamSource
{
    private static final Logger log = LoggerFactory.getLogger(SocketStreamSource.class);

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final Endpoint local;
    private final Endpoint remote;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param socket      a connected socket
     * @param readTimeoutMillis {@code SO_TIMEOUT} to apply, 0 for none
     */
    public SocketStreamSource(Socket socket, int readTimeoutMillis) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        socket.setTcpNoDelay(true);
        socket.setSoTimeout(readTimeoutMillis);

        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.local = Endpoint.of(socket.getLocalSocketAddress());
        this.remote = Endpoint.of(socket.getRemoteSocketAddress());
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException
    {
        return in.read(buffer, offset, length);
    }

    @Override
    public void write(byte[] bytes) throws IOException
    {
        Objects.requireNonNull(bytes, "bytes");
        out.write(bytes);
        out.flush();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        }
        catch (IOException e) {
            // Nothing left to release; the descriptor is gone either way.
            log.debug("Error closing socket to {}", remote, e);
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && !socket.isClosed();
    }

    @Override
    public Endpoint localEndpoint()
    {
        return local;
    }

    @Override
    public Endpoint remoteEndpoint()
    {
        return remote;
    }

    @Override
    public String toString()
    {
        return "SocketStreamSource[" + local + " <-> " + remote + "]";
    }
}
