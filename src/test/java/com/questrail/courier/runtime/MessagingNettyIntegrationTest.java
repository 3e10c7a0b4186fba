package com.questrail.courier.runtime;

import com.questrail.courier.transport.StreamTransport;
import com.questrail.courier.transport.netty.NettyStreamTransport;

import java.time.Duration;

/**
 * Runs the end-to-end scenarios over the Netty transport.
 */
final class MessagingNettyIntegrationTest extends AbstractMessagingTransportTests
{
    @Override
    protected StreamTransport newTransport()
    {
        return new NettyStreamTransport(2, Duration.ofSeconds(5));
    }
}
