package com.questrail.courier.runtime;

import com.questrail.courier.codec.MessageFrameDecoder;
import com.questrail.courier.codec.MessageFrameEncoder;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.connection.ConnectionHandler;
import com.questrail.courier.connection.Direction;
import com.questrail.courier.connection.MessageHandler;
import com.questrail.courier.model.Endpoint;
import com.questrail.courier.observability.ConnectionEvent;
import com.questrail.courier.observability.MessagingErrorEvent;
import com.questrail.courier.observability.MessagingObservabilitySink;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionListener
 * =============================================================================
 * Server role of the Listener/Dispatcher: accepts connections and gives each
 * one a {@link ConnectionHandler} running on its own worker.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>One dedicated accept thread ({@code courier-accept-<port>}).</li>
 *   <li>One worker per accepted connection, taken from the supplied executor.</li>
 * </ul>
 *
 * <h2>Shared state</h2>
 * The set of live connections is shared between the accept loop, connection
 * workers (removal on termination) and {@link #stop()}. Every access holds
 * {@code connectionsLock}. A connection accepted after {@code stop()} has
 * snapshotted the set is closed instead of being added.
 *
 * <h2>Accept failures</h2>
 * An {@link IOException} from the acceptor (for example, descriptor
 * exhaustion) is reported to the observability sink and the loop continues
 * after {@link #ACCEPT_FAILURE_BACKOFF}. It never affects open connections.
 */
public final class ConnectionListener implements ListenerHandle
{
    static final Duration ACCEPT_FAILURE_BACKOFF = Duration.ofMillis(100);

    private final Acceptor acceptor;
    private final Executor workers;
    private final MessageFrameDecoder decoder;
    private final MessageFrameEncoder encoder;
    private final MessageHandler handler;
    private final MessagingObservabilitySink sink;

    private final Object connectionsLock = new Object();
    private final Set<ConnectionHandler> connections = new HashSet<>();

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final CountDownLatch acceptLoopExited = new CountDownLatch(1);

    private volatile Endpoint localEndpoint;

    public ConnectionListener(Acceptor acceptor,
                              Executor workers,
                              MessageFrameDecoder decoder,
                              MessageFrameEncoder encoder,
                              MessageHandler handler,
                              MessagingObservabilitySink sink) {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Bind and start the accept loop.
     *
     * @return the bound endpoint
     * @throws IOException if binding fails
     */
    public Endpoint start(EndpointConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Listener already started");
        }

        Endpoint bound = acceptor.bind(config);
        this.localEndpoint = bound;

        Thread acceptThread = new Thread(this::acceptLoop, "courier-accept-" + bound.port());
        acceptThread.setDaemon(true);
        acceptThread.start();

        sink.onConnectionEvent(ConnectionEvent.listenerStarted(bound));
        return bound;
    }

    private void acceptLoop() {
        try {
            while (!stopped.get()) {
                final Optional<StreamSource> accepted;
                try {
                    accepted = acceptor.accept();
                }
                catch (IOException e) {
                    if (stopped.get()) {
                        break;
                    }
                    sink.onError(MessagingErrorEvent.of("Accept failed on " + localEndpoint, e));
                    pauseAfterAcceptFailure();
                    continue;
                }

                if (accepted.isEmpty()) {
                    // Shutdown indication.
                    break;
                }
                dispatch(accepted.get());
            }
        }
        finally {
            acceptLoopExited.countDown();
        }
    }

    private void dispatch(StreamSource source) {
        ConnectionHandler connection = new ConnectionHandler(
                source, Direction.INBOUND, decoder, encoder, handler, sink, this::untrack);

        synchronized (connectionsLock) {
            if (stopped.get()) {
                connection.close();
                return;
            }
            connections.add(connection);
        }

        try {
            workers.execute(connection);
        }
        catch (RejectedExecutionException e) {
            sink.onError(MessagingErrorEvent.of("No worker available for connection from " + connection.peer(), e));
            connection.close();
        }
    }

    private void untrack(ConnectionHandler connection) {
        synchronized (connectionsLock) {
            connections.remove(connection);
        }
    }

    private void pauseAfterAcceptFailure() {
        try {
            Thread.sleep(ACCEPT_FAILURE_BACKOFF.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        acceptor.stop();

        List<ConnectionHandler> snapshot;
        synchronized (connectionsLock) {
            snapshot = new ArrayList<>(connections);
            connections.clear();
        }
        // Close outside the lock: termination calls back into untrack().
        for (ConnectionHandler c : snapshot) {
            c.close();
        }

        Endpoint local = localEndpoint;
        if (local != null) {
            sink.onConnectionEvent(ConnectionEvent.listenerStopped(local));
        }
        if (!started.get()) {
            acceptLoopExited.countDown();
        }
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return acceptLoopExited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public Endpoint localEndpoint() {
        Endpoint local = localEndpoint;
        if (local == null) {
            throw new IllegalStateException("Listener not started");
        }
        return local;
    }

    @Override
    public int connectionCount() {
        synchronized (connectionsLock) {
            return connections.size();
        }
    }
}
