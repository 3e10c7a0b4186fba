package com.questrail.courier.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pipe
 * -----------------------------------------------------------------------------
 * One direction of an in-memory byte stream. Writes are stored as whole
 * chunks, so a single {@code write} is never interleaved with another.
 */
final class Pipe {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readable = lock.newCondition();
    private final Deque<byte[]> chunks = new ArrayDeque<>();

    private int headOffset;
    private boolean writerClosed;
    private boolean readerClosed;

    void write(byte[] bytes) throws IOException {
        lock.lock();
        try {
            if (writerClosed || readerClosed) {
                throw new SocketException("Broken pipe");
            }
            if (bytes.length > 0) {
                chunks.addLast(bytes.clone());
                readable.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    int read(byte[] buffer, int offset, int length, int maxChunk, int timeoutMillis) throws IOException {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            while (readerClosed || chunks.isEmpty()) {
                if (readerClosed) {
                    throw new SocketException("Stream closed");
                }
                if (writerClosed) {
                    return -1;
                }
                if (timeoutMillis > 0) {
                    if (remaining <= 0) {
                        throw new SocketTimeoutException("Read timed out");
                    }
                    remaining = readable.awaitNanos(remaining);
                } else {
                    readable.await();
                }
            }

            byte[] head = chunks.peekFirst();
            int n = Math.min(Math.min(length, maxChunk), head.length - headOffset);
            System.arraycopy(head, headOffset, buffer, offset, n);
            headOffset += n;
            if (headOffset == head.length) {
                chunks.removeFirst();
                headOffset = 0;
            }
            return n;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException();
        } finally {
            lock.unlock();
        }
    }

    void closeWriter() {
        lock.lock();
        try {
            writerClosed = true;
            readable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void closeReader() {
        lock.lock();
        try {
            readerClosed = true;
            chunks.clear();
            readable.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
