package com.questrail.courier.transport.netty;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;
import com.questrail.courier.transport.StreamTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyStreamTransport
 * =============================================================================
 * Netty-backed implementation of the {@link StreamTransport} port.
 *
 * <h2>Lifecycle</h2>
 * The transport owns one boss event loop (accepts) and a worker event loop
 * group (I/O for every accepted and outbound channel). {@link #close()} shuts
 * both down; acceptors and streams created from this transport are unusable
 * afterwards.
 */
public final class NettyStreamTransport implements StreamTransport
{
    private static final AttributeKey<NettyStreamSource> SOURCE =
            AttributeKey.valueOf(NettyStreamTransport.class, "source");

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Duration connectTimeout;

    public NettyStreamTransport()
    {
        this(0, Duration.ofSeconds(10));
    }

    /**
     * @param workerThreads  event loop threads for channel I/O, 0 for Netty's default
     * @param connectTimeout timeout for outbound connects
     */
    public NettyStreamTransport(int workerThreads, Duration connectTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("courier-netty-boss", true));
        this.workerGroup = new NioEventLoopGroup(workerThreads, new DefaultThreadFactory("courier-netty-io", true));
    }

    @Override
    public Acceptor newAcceptor()
    {
        return new NettyAcceptor(bossGroup, workerGroup);
    }

    @Override
    public StreamSource connect(EndpointConfig config) throws IOException
    {
        Objects.requireNonNull(config, "config");
        config.requireConnectable();

        final int readTimeoutMillis = config.readTimeoutMillis();

        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamSource source = new NettyStreamSource(ch, readTimeoutMillis);
                        ch.attr(SOURCE).set(source);
                        ch.pipeline().addLast(source.inboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(config.endpoint().toSocketAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            Throwable cause = f.cause();
            throw cause instanceof IOException io ? io : new IOException("Connect failed: " + config.endpoint(), cause);
        }

        NettyStreamSource source = f.channel().attr(SOURCE).get();
        if (source == null) {
            f.channel().close();
            throw new IOException("Channel initialization did not complete for " + config.endpoint());
        }
        // The connect promise completes before channelActive runs.
        source.captureEndpoints();
        return source;
    }

    @Override
    public void close()
    {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        bossGroup.terminationFuture().awaitUninterruptibly(5, TimeUnit.SECONDS);
        workerGroup.terminationFuture().awaitUninterruptibly(5, TimeUnit.SECONDS);
    }
}
