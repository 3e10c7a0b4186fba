package com.questrail.courier.transport;

import com.questrail.courier.model.Endpoint;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ByteArrayStreamSource
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamSource} that replays a fixed byte sequence in chunks
 * of at most {@code chunkSize} bytes, then reports end of stream. Writes are
 * captured.
 */
public final class ByteArrayStreamSource implements StreamSource {

    private final byte[] data;
    private final int chunkSize;
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final AtomicInteger reads = new AtomicInteger();
    private int position;
    private boolean closed;

    public ByteArrayStreamSource(byte[] data) {
        this(data, Integer.MAX_VALUE);
    }

    public ByteArrayStreamSource(byte[] data, int chunkSize) {
        this.data = data.clone();
        this.chunkSize = chunkSize;
    }

    @Override
    public synchronized int read(byte[] buffer, int offset, int length) throws IOException {
        if (closed) {
            throw new IOException("closed");
        }
        reads.incrementAndGet();
        if (position >= data.length) {
            return -1;
        }
        int n = Math.min(Math.min(length, chunkSize), data.length - position);
        System.arraycopy(data, position, buffer, offset, n);
        position += n;
        return n;
    }

    @Override
    public synchronized void write(byte[] bytes) throws IOException {
        if (closed) {
            throw new IOException("closed");
        }
        written.write(bytes);
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    @Override
    public synchronized boolean isOpen() {
        return !closed;
    }

    @Override
    public Endpoint localEndpoint() {
        return new Endpoint("local.test", 1);
    }

    @Override
    public Endpoint remoteEndpoint() {
        return new Endpoint("remote.test", 2);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized int position() {
        return position;
    }

    public int readCalls() {
        return reads.get();
    }

    public synchronized byte[] written() {
        return written.toByteArray();
    }
}
