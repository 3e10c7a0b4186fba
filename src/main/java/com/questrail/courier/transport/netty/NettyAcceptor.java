package com.questrail.courier.transport.netty;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.model.Endpoint;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyAcceptor
 * =============================================================================
 * Netty-backed implementation of the {@link Acceptor} port.
 *
 * <p>Netty accepts on its boss event loop and initializes each child channel
 * with a {@link NettyStreamSource}; the source is queued and handed out by
 * {@link #accept()}. A blocked {@code accept()} re-checks the stop flag every
 * {@value #STOP_POLL_MILLIS} ms, which bounds how long {@link #stop()} takes to
 * release it.</p>
 */
final class NettyAcceptor implements Acceptor
{
    static final long STOP_POLL_MILLIS = 50;

    private static final int BACKLOG = 50;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final BlockingQueue<NettyStreamSource> accepted = new LinkedBlockingQueue<>();

    private volatile Channel serverChannel;
    private volatile boolean stopped;

    NettyAcceptor(EventLoopGroup bossGroup, EventLoopGroup workerGroup)
    {
        this.bossGroup = Objects.requireNonNull(bossGroup, "bossGroup");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
    }

    @Override
    public synchronized Endpoint bind(EndpointConfig config) throws IOException
    {
        Objects.requireNonNull(config, "config");
        if (serverChannel != null) {
            throw new IllegalStateException("Acceptor already bound");
        }
        if (stopped) {
            throw new IllegalStateException("Acceptor stopped");
        }

        final int readTimeoutMillis = config.readTimeoutMillis();

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, BACKLOG)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamSource source = new NettyStreamSource(ch, readTimeoutMillis);
                        ch.pipeline().addLast(source.inboundHandler());
                        if (stopped) {
                            source.close();
                        }
                        else {
                            accepted.add(source);
                        }
                    }
                });

        ChannelFuture f = bootstrap.bind(config.endpoint().toSocketAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            Throwable cause = f.cause();
            throw cause instanceof IOException io ? io : new IOException("Bind failed: " + config.endpoint(), cause);
        }

        serverChannel = f.channel();
        return Endpoint.of(serverChannel.localAddress());
    }

    @Override
    public Optional<StreamSource> accept() throws IOException
    {
        if (serverChannel == null) {
            throw new IllegalStateException("Acceptor not bound");
        }
        try {
            while (!stopped) {
                NettyStreamSource source = accepted.poll(STOP_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (source != null) {
                    return Optional.of(source);
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Optional.empty();
    }

    @Override
    public void stop()
    {
        stopped = true;
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        // Connections accepted but never handed out are owned by nobody else.
        NettyStreamSource orphan;
        while ((orphan = accepted.poll()) != null) {
            orphan.close();
        }
    }

    @Override
    public boolean isStopped()
    {
        return stopped;
    }
}
