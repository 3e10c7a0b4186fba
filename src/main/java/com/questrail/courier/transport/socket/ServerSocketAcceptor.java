package com.questrail.courier.transport.socket;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.model.Endpoint;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Objects;
import java.util.Optional;

/**
 * ServerSocketAcceptor
 * =============================================================================
 * {@link Acceptor} over a blocking {@link ServerSocket}.
 *
 * <h2>Stop semantics</h2>
 * {@link #stop()} closes the server socket, which makes a blocked
 * {@link ServerSocket#accept()} throw {@link SocketException}. Once the stop
 * flag is set that exception is the shutdown indication and is translated to
 * {@link Optional#empty()}.
 */
public final class ServerSocketAcceptor implements Acceptor
{
    private static final Logger log = LoggerFactory.getLogger(ServerSocketAcceptor.class);

    private static final int BACKLOG = 50;

    private volatile ServerSocket serverSocket;
    private volatile boolean stopped;
    private int readTimeoutMillis;

    @Override
    public synchronized Endpoint bind(EndpointConfig config) throws IOException
    {
        Objects.requireNonNull(config, "config");
        if (serverSocket != null) {
            throw new IllegalStateException("Acceptor already bound");
        }
        if (stopped) {
            throw new IllegalStateException("Acceptor stopped");
        }

        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(config.endpoint().toSocketAddress(), BACKLOG);
        }
        catch (IOException e) {
            ss.close();
            throw e;
        }

        this.readTimeoutMillis = config.readTimeoutMillis();
        this.serverSocket = ss;
        return Endpoint.of(ss.getLocalSocketAddress());
    }

    @Override
    public Optional<StreamSource> accept() throws IOException
    {
        ServerSocket ss = serverSocket;
        if (ss == null) {
            throw new IllegalStateException("Acceptor not bound");
        }
        if (stopped) {
            return Optional.empty();
        }

        final Socket socket;
        try {
            socket = ss.accept();
        }
        catch (SocketException e) {
            if (stopped || ss.isClosed()) {
                return Optional.empty();
            }
            throw e;
        }

        try {
            return Optional.of(new SocketStreamSource(socket, readTimeoutMillis));
        }
        catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    @Override
    public void stop()
    {
        stopped = true;
        ServerSocket ss = serverSocket;
        if (ss == null) {
            return;
        }
        try {
            ss.close();
        }
        catch (IOException e) {
            log.debug("Error closing server socket", e);
        }
    }

    @Override
    public boolean isStopped()
    {
        return stopped;
    }
}
