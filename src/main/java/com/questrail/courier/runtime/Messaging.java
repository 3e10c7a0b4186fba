package com.questrail.courier.runtime;

import com.questrail.courier.codec.MessageFrameDecoder;
import com.questrail.courier.codec.MessageFrameEncoder;
import com.questrail.courier.codec.impl.DefaultMessageFrameDecoder;
import com.questrail.courier.codec.impl.DefaultMessageFrameEncoder;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.config.ServiceRegistry;
import com.questrail.courier.connection.ConnectionHandle;
import com.questrail.courier.connection.ConnectionHandler;
import com.questrail.courier.connection.Direction;
import com.questrail.courier.connection.MessageHandler;
import com.questrail.courier.error.TransportException;
import com.questrail.courier.observability.MessagingObservabilitySink;
import com.questrail.courier.observability.Slf4jMessagingObservabilitySink;
import com.questrail.courier.transport.StreamSource;
import com.questrail.courier.transport.StreamTransport;
import com.questrail.courier.transport.socket.SocketStreamTransport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Messaging
 * =============================================================================
 * Composition root and lifecycle owner for the messaging stack.
 *
 * <h2>Ownership</h2>
 * A {@code Messaging} instance owns its {@link StreamTransport}, the worker
 * executor that runs one {@link ConnectionHandler} per connection, and every
 * listener and client connection it creates. {@link #close()} releases all of
 * them.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (Messaging messaging = Messaging.builder().build()) {
 *     ListenerHandle server = messaging.listen("0.0.0.0", 9000,
 *             (message, connection) -> connection.send(message));
 *     ConnectionHandle client = messaging.connect("localhost", 9000);
 *     client.send(Message.newRawMessage("<xml>ok</xml>"));
 * }
 * }</pre>
 *
 * <p>No retry or reconnect logic lives here. After a timeout or transport
 * failure, callers reconnect explicitly.</p>
 */
public final class Messaging implements AutoCloseable
{
    private final StreamTransport transport;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final MessageFrameDecoder decoder;
    private final MessageFrameEncoder encoder;
    private final MessagingObservabilitySink sink;
    private final ServiceRegistry services;

    private final Object lock = new Object();
    private final List<ConnectionListener> listeners = new ArrayList<>();
    private final Set<ConnectionHandler> clients = new HashSet<>();
    private boolean closed;

    private Messaging(Builder b) {
        this.transport = b.transport;
        this.ownsWorkers = b.workers == null;
        this.workers = ownsWorkers
                ? Executors.newCachedThreadPool(new WorkerThreadFactory("courier-worker"))
                : b.workers;
        // One limit for both directions: anything this instance can send, its peer can receive.
        this.decoder = new DefaultMessageFrameDecoder(b.maxInboundBodyLength);
        this.encoder = new DefaultMessageFrameEncoder(b.maxInboundBodyLength);
        this.sink = b.observabilitySink;
        this.services = b.services;
    }

    // -------------------------------------------------------------------------
    // Server role
    // -------------------------------------------------------------------------

    public ListenerHandle listen(String host, int port, MessageHandler onMessage) {
        return listen(EndpointConfig.of(host, port), onMessage);
    }

    /**
     * Bind and start accepting connections. Every decoded frame on every
     * accepted connection is passed to {@code onMessage}.
     *
     * @throws TransportException if the endpoint cannot be bound
     */
    public ListenerHandle listen(EndpointConfig config, MessageHandler onMessage) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(onMessage, "onMessage");

        ConnectionListener listener = new ConnectionListener(
                transport.newAcceptor(), workers, decoder, encoder, onMessage, sink);

        synchronized (lock) {
            ensureNotClosed();
            listeners.add(listener);
        }
        try {
            listener.start(config);
        }
        catch (IOException e) {
            listener.stop();
            synchronized (lock) {
                listeners.remove(listener);
            }
            throw new TransportException("Cannot listen on " + config.endpoint(), e);
        }
        return listener;
    }

    // -------------------------------------------------------------------------
    // Client role
    // -------------------------------------------------------------------------

    public ConnectionHandle connect(String host, int port) {
        return connect(EndpointConfig.of(host, port), MessageHandler.ignoring());
    }

    public ConnectionHandle connect(EndpointConfig config) {
        return connect(config, MessageHandler.ignoring());
    }

    /**
     * Connect to a service registered in this instance's {@link ServiceRegistry}.
     *
     * @throws IllegalArgumentException if the service is not registered
     */
    public ConnectionHandle connect(String serviceName) {
        return connect(services.resolve(serviceName), MessageHandler.ignoring());
    }

    public ConnectionHandle connect(String serviceName, MessageHandler onMessage) {
        return connect(services.resolve(serviceName), onMessage);
    }

    /**
     * Open an outbound connection. The returned handle is already reading;
     * messages that are not replies to {@link ConnectionHandle#request} go to
     * {@code onMessage}.
     *
     * @throws TransportException if the connection cannot be established
     */
    public ConnectionHandle connect(EndpointConfig config, MessageHandler onMessage) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(onMessage, "onMessage");
        config.requireConnectable();
        synchronized (lock) {
            ensureNotClosed();
        }

        final StreamSource source;
        try {
            source = transport.connect(config);
        }
        catch (IOException e) {
            throw new TransportException("Cannot connect to " + config.endpoint(), e);
        }

        ConnectionHandler connection = new ConnectionHandler(
                source, Direction.OUTBOUND, decoder, encoder, onMessage, sink, this::untrack);

        boolean rejected;
        synchronized (lock) {
            rejected = closed;
            if (!rejected) {
                clients.add(connection);
            }
        }
        if (rejected) {
            connection.close();
            throw new IllegalStateException("Messaging is closed");
        }

        try {
            workers.execute(connection);
        }
        catch (RejectedExecutionException e) {
            connection.close();
            throw new TransportException("No worker available for connection to " + config.endpoint(), e);
        }
        return connection;
    }

    private void untrack(ConnectionHandler connection) {
        synchronized (lock) {
            clients.remove(connection);
        }
    }

    public ServiceRegistry services() {
        return services;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Stop every listener, close every client connection, release the
     * transport and shut down the worker pool (when owned). Idempotent.
     */
    @Override
    public void close() {
        List<ConnectionListener> listenerSnapshot;
        List<ConnectionHandler> clientSnapshot;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            listenerSnapshot = new ArrayList<>(listeners);
            clientSnapshot = new ArrayList<>(clients);
            listeners.clear();
            clients.clear();
        }

        for (ConnectionListener l : listenerSnapshot) {
            l.stop();
        }
        for (ConnectionHandler c : clientSnapshot) {
            c.close();
        }
        transport.close();

        if (ownsWorkers) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Messaging is closed");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StreamTransport transport;
        private ExecutorService workers;
        private MessagingObservabilitySink observabilitySink = new Slf4jMessagingObservabilitySink();
        private ServiceRegistry services = ServiceRegistry.empty();
        private int maxInboundBodyLength = DefaultMessageFrameDecoder.DEFAULT_MAX_BODY_LENGTH;

        public Builder withTransport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Use a caller-owned executor for connection workers. It must be able
         * to run one long-lived task per open connection at once. The caller
         * remains responsible for shutting it down.
         */
        public Builder withWorkers(ExecutorService workers) {
            this.workers = workers;
            return this;
        }

        public Builder withObservabilitySink(MessagingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withServices(ServiceRegistry services) {
            this.services = services;
            return this;
        }

        /**
         * Largest message body accepted from a peer, and the largest this
         * instance will encode. Larger outbound messages fail with
         * {@link com.questrail.courier.error.PayloadTooLargeException} before
         * anything is written.
         */
        public Builder withMaxInboundBodyLength(int maxInboundBodyLength) {
            this.maxInboundBodyLength = maxInboundBodyLength;
            return this;
        }

        public Messaging build() {
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(services, "services");
            if (transport == null) {
                transport = new SocketStreamTransport();
            }
            return new Messaging(this);
        }
    }
}
