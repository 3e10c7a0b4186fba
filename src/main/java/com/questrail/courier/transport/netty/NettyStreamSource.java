package com.questrail.courier.transport.netty;

import com.questrail.courier.model.Endpoint;
import com.questrail.courier.transport.StreamSource;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * NettyStreamSource
 * =============================================================================
 * {@link StreamSource} over a Netty {@link Channel}.
 *
 * <p>The event loop appends inbound bytes to a private cumulation buffer via
 * {@link InboundBridge}; worker threads drain it through {@link #read}.
 * Writes block until Netty reports the flush outcome so that I/O failures
 * surface to the writer as {@link IOException}.</p>
 */
final class NettyStreamSource implements StreamSource
{
    static final int HIGH_WATER_MARK = 256 * 1024;
    static final int LOW_WATER_MARK = HIGH_WATER_MARK / 2;

    private final Channel channel;
    private final int readTimeoutMillis;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readable = lock.newCondition();
    private final ByteBuf cumulation = Unpooled.buffer();
    private final AtomicBoolean closed = new AtomicBoolean();

    // Guarded by lock.
    private boolean inputShutdown;
    private Throwable failure;

    private volatile Endpoint local;
    private volatile Endpoint remote;

    NettyStreamSource(Channel channel, int readTimeoutMillis)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.readTimeoutMillis = readTimeoutMillis;
        captureEndpoints();
    }

    /**
     * @return the handler that must be installed in this channel's pipeline
     */
    ChannelInboundHandlerAdapter inboundHandler()
    {
        return new InboundBridge();
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException
    {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (length == 0) {
            return 0;
        }

        lock.lock();
        try {
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(readTimeoutMillis);
            while (closed.get() || !cumulation.isReadable()) {
                if (closed.get()) {
                    throw new SocketException("Stream closed");
                }
                if (failure != null) {
                    throw toIOException(failure);
                }
                if (inputShutdown) {
                    return -1;
                }
                if (readTimeoutMillis > 0) {
                    if (remainingNanos <= 0) {
                        throw new SocketTimeoutException("Read timed out after " + readTimeoutMillis + " ms");
                    }
                    remainingNanos = readable.awaitNanos(remainingNanos);
                }
                else {
                    readable.await();
                }
            }

            int n = Math.min(length, cumulation.readableBytes());
            cumulation.readBytes(buffer, offset, n);
            cumulation.discardSomeReadBytes();

            if (!channel.config().isAutoRead() && cumulation.readableBytes() < LOW_WATER_MARK) {
                channel.config().setAutoRead(true);
            }
            return n;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading");
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void write(byte[] bytes) throws IOException
    {
        Objects.requireNonNull(bytes, "bytes");
        if (closed.get()) {
            throw new SocketException("Stream closed");
        }

        ChannelFuture f = channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw toIOException(f.cause());
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close();

        lock.lock();
        try {
            cumulation.release();
            readable.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && channel.isOpen();
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

    void captureEndpoints()
    {
        SocketAddress l = channel.localAddress();
        SocketAddress r = channel.remoteAddress();
        if (l != null) {
            local = Endpoint.of(l);
        }
        if (r != null) {
            remote = Endpoint.of(r);
        }
    }

    private static IOException toIOException(Throwable cause)
    {
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException(cause);
    }

    @Override
    public String toString()
    {
        return "NettyStreamSource[" + local + " <-> " + remote + "]";
    }

    /**
     * InboundBridge
     * -------------------------------------------------------------------------
     * Runs on the channel's event loop. Copies inbound bytes into the
     * cumulation buffer and wakes blocked readers; never blocks.
     */
    private final class InboundBridge extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            captureEndpoints();
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ByteBuf in = (ByteBuf) msg;
            lock.lock();
            try {
                if (closed.get()) {
                    return;
                }
                cumulation.writeBytes(in);
                if (cumulation.readableBytes() >= HIGH_WATER_MARK) {
                    ctx.channel().config().setAutoRead(false);
                }
                readable.signalAll();
            }
            finally {
                lock.unlock();
                in.release();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            lock.lock();
            try {
                inputShutdown = true;
                readable.signalAll();
            }
            finally {
                lock.unlock();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            lock.lock();
            try {
                if (failure == null) {
                    failure = cause;
                }
                readable.signalAll();
            }
            finally {
                lock.unlock();
            }
            ctx.close();
        }
    }
}
