package com.questrail.courier.connection;

import com.questrail.courier.codec.MessageFrameDecoder;
import com.questrail.courier.codec.MessageFrameEncoder;
import com.questrail.courier.error.ConnectionClosedException;
import com.questrail.courier.error.MessagingException;
import com.questrail.courier.error.ProtocolException;
import com.questrail.courier.error.ReadTimeoutException;
import com.questrail.courier.error.TransportException;
import com.questrail.courier.model.Endpoint;
import com.questrail.courier.model.Message;
import com.questrail.courier.observability.ConnectionEvent;
import com.questrail.courier.observability.MessagingErrorEvent;
import com.questrail.courier.observability.MessagingObservabilitySink;
import com.questrail.courier.transport.StreamSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * ConnectionHandler
 * =============================================================================
 * Owns one {@link StreamSource} and drives its read/dispatch loop.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   StreamSource
 *        → MessageFrameDecoder
 *            → pending request (if any)  or  MessageHandler.onMessage
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Message
 *        → MessageFrameEncoder      (outside the write lock)
 *            → StreamSource.write   (under the write lock, one call per frame)
 * </pre>
 *
 * <h2>Execution model</h2>
 * {@link #run()} is the connection's worker and must be executed exactly once,
 * on a thread of its own. Reads and dispatches are strictly serial, so frames
 * are handled in arrival order. {@link #send}, {@link #request} and
 * {@link #close()} may be called from any thread.
 *
 * <h2>Termination</h2>
 * Whatever ends the connection (clean disconnect, protocol error, read
 * timeout, transport failure, local close), termination runs once: the
 * stream is closed, pending requests fail, the observability sink and the
 * handler's {@code onClosed} are notified, and the termination callback lets
 * the owner stop tracking this connection.
 */
public final class ConnectionHandler implements ConnectionHandle, Runnable
{
    private final StreamSource source;
    private final Direction direction;
    private final MessageFrameDecoder decoder;
    private final MessageFrameEncoder encoder;
    private final MessageHandler handler;
    private final MessagingObservabilitySink sink;
    private final Consumer<? super ConnectionHandler> terminationCallback;

    private final Endpoint local;
    private final Endpoint peer;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final ReentrantLock writeLock = new ReentrantLock();

    // Appended under writeLock in write order; polled by the worker.
    private final Queue<CompletableFuture<Message>> pendingReplies = new ConcurrentLinkedQueue<>();

    public ConnectionHandler(StreamSource source,
                             Direction direction,
                             MessageFrameDecoder decoder,
                             MessageFrameEncoder encoder,
                             MessageHandler handler,
                             MessagingObservabilitySink sink) {
        this(source, direction, decoder, encoder, handler, sink, c -> {});
    }

    public ConnectionHandler(StreamSource source,
                             Direction direction,
                             MessageFrameDecoder decoder,
                             MessageFrameEncoder encoder,
                             MessageHandler handler,
                             MessagingObservabilitySink sink,
                             Consumer<? super ConnectionHandler> terminationCallback) {
        this.source = Objects.requireNonNull(source, "source");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.terminationCallback = Objects.requireNonNull(terminationCallback, "terminationCallback");

        this.local = source.localEndpoint();
        this.peer = source.remoteEndpoint();
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    @Override
    public void run() {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.READING)) {
            return;
        }
        sink.onConnectionEvent(ConnectionEvent.opened(direction, local, peer));

        MessagingException cause = null;
        try {
            while (true) {
                Optional<Message> next = decoder.decode(source);
                if (next.isEmpty()) {
                    // Clean disconnect.
                    break;
                }
                if (!state.compareAndSet(ConnectionState.READING, ConnectionState.DISPATCHING)) {
                    break;
                }
                dispatch(next.get());
                if (!state.compareAndSet(ConnectionState.DISPATCHING, ConnectionState.READING)) {
                    break;
                }
            }
        }
        catch (ProtocolException e) {
            cause = e;
        }
        catch (SocketTimeoutException e) {
            cause = new ReadTimeoutException("No frame from " + peer + " within the read timeout", e);
        }
        catch (IOException e) {
            // A failed read after a local close is the close itself, not a transport fault.
            if (state.get() != ConnectionState.CLOSED) {
                cause = new TransportException("Read from " + peer + " failed", e);
            }
        }
        finally {
            terminate(cause);
        }
    }

    private void dispatch(Message message) {
        CompletableFuture<Message> pending = pendingReplies.poll();
        if (pending != null) {
            if (!pending.complete(message)) {
                sink.onDiagnostic("Discarded late reply from " + peer + " to a request that timed out");
            }
            return;
        }

        try {
            handler.onMessage(message, this);
        }
        catch (RuntimeException e) {
            sink.onError(MessagingErrorEvent.of("Message handler failed for " + message.kind() + " from " + peer, e));
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public void send(Message message) {
        Objects.requireNonNull(message, "message");
        ensureOpen();
        writeFrame(encoder.encode(message), null);
    }

    @Override
    public CompletableFuture<Message> request(Message message) {
        Objects.requireNonNull(message, "message");
        ensureOpen();
        byte[] frame = encoder.encode(message);

        CompletableFuture<Message> reply = new CompletableFuture<>();
        writeFrame(frame, reply);
        return reply;
    }

    @Override
    public Message request(Message message, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        CompletableFuture<Message> reply = request(message);
        try {
            return reply.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            // Stays queued so the late reply is matched to it and dropped.
            reply.cancel(false);
            throw new ReadTimeoutException("No reply from " + peer + " within " + timeout, e);
        }
        catch (InterruptedException e) {
            reply.cancel(false);
            throw e;
        }
        catch (ExecutionException e) {
            Throwable c = e.getCause();
            if (c instanceof MessagingException me) {
                throw me;
            }
            throw new TransportException("Request to " + peer + " failed", c);
        }
    }

    private void writeFrame(byte[] frame, CompletableFuture<Message> reply) {
        final TransportException failure;
        writeLock.lock();
        try {
            ensureOpen();
            if (reply != null) {
                pendingReplies.add(reply);
            }
            source.write(frame);
            return;
        }
        catch (IOException e) {
            if (state.get() == ConnectionState.CLOSED) {
                throw new ConnectionClosedException("Connection to " + peer + " closed during write", e);
            }
            failure = new TransportException("Write to " + peer + " failed", e);
        }
        finally {
            writeLock.unlock();
        }

        // Outside the lock: onClosed and the termination callback must not stall other senders.
        terminate(failure);
        throw failure;
    }

    private void ensureOpen() {
        if (state.get() == ConnectionState.CLOSED) {
            throw new ConnectionClosedException("Connection to " + peer + " is closed");
        }
    }

    // -------------------------------------------------------------------------
    // Termination
    // -------------------------------------------------------------------------

    @Override
    public void close() {
        terminate(null);
    }

    private void terminate(MessagingException cause) {
        // Claim termination before closing the stream, so the reader woken by
        // the close cannot report itself as the cause.
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        state.set(ConnectionState.CLOSED);
        source.close();

        // Any request that got past ensureOpen() has enqueued by the time we hold the lock.
        writeLock.lock();
        try {
            CompletableFuture<Message> pending;
            while ((pending = pendingReplies.poll()) != null) {
                pending.completeExceptionally(cause != null
                        ? cause
                        : new ConnectionClosedException("Connection to " + peer + " closed before a reply arrived"));
            }
        }
        finally {
            writeLock.unlock();
        }

        sink.onConnectionEvent(ConnectionEvent.closed(direction, local, peer, cause));
        try {
            handler.onClosed(this, Optional.ofNullable(cause));
        }
        catch (RuntimeException e) {
            sink.onError(MessagingErrorEvent.of("Close handler failed for " + peer, e));
        }
        terminationCallback.accept(this);
    }

    // -------------------------------------------------------------------------
    // Connection
    // -------------------------------------------------------------------------

    @Override
    public Endpoint peer() {
        return peer;
    }

    @Override
    public Endpoint localEndpoint() {
        return local;
    }

    @Override
    public Direction direction() {
        return direction;
    }

    @Override
    public ConnectionState state() {
        return state.get();
    }

    @Override
    public String toString() {
        return "ConnectionHandler[" + direction + " " + local + " <-> " + peer + ", " + state.get() + "]";
    }
}
