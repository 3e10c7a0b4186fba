package com.questrail.courier.transport;

import com.questrail.courier.model.Endpoint;

import java.io.Closeable;
import java.io.IOException;

/**
 * StreamSource
 * -----------------------------------------------------------------------------
 * Minimal port for one bidirectional byte stream.
 *
 * <p>Streams deliver data in arbitrary chunk sizes. A single {@link #read}
 * may return fewer bytes than requested; accumulating a complete frame is the
 * codec's job, not the transport's.</p>
 */
public interface StreamSource extends Closeable
{
    /**
     * Block until at least one byte is available, the stream ends, or the
     * configured read timeout elapses.
     *
     * @return number of bytes read (at least 1), or {@code -1} at end of stream
     * @throws java.net.SocketTimeoutException if the read timeout elapsed
     * @throws IOException on any other transport failure, including reading
     *         from a stream that was closed locally
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Write all of {@code bytes}, blocking until the transport accepts them.
     *
     * <p>Callers that need frames to stay contiguous must serialize calls
     * themselves; a single call is never split by this port, but two
     * concurrent calls may interleave.</p>
     */
    void write(byte[] bytes) throws IOException;

    /**
     * Close the stream and unblock any pending {@link #read}. Idempotent.
     */
    @Override
    void close();

    boolean isOpen();

    Endpoint localEndpoint();

    Endpoint remoteEndpoint();
}
