package com.questrail.courier.runtime;

import com.questrail.courier.transport.StreamTransport;
import com.questrail.courier.transport.socket.SocketStreamTransport;

/**
 * Runs the end-to-end scenarios over blocking {@code java.net} sockets.
 */
final class MessagingSocketIntegrationTest extends AbstractMessagingTransportTests
{
    @Override
    protected StreamTransport newTransport()
    {
        return new SocketStreamTransport();
    }
}
