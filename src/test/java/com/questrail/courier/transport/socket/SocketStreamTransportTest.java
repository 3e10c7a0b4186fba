package com.questrail.courier.transport.socket;

import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.model.Endpoint;
import com.questrail.courier.transport.Acceptor;
import com.questrail.courier.transport.StreamSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SocketStreamTransportTest
{
    private final SocketStreamTransport transport = new SocketStreamTransport();
    private final Acceptor acceptor = transport.newAcceptor();

    @AfterEach
    void tearDown()
    {
        acceptor.stop();
        transport.close();
    }

    @Test
    void bytesFlowBothWays() throws Exception
    {
        Endpoint bound = acceptor.bind(EndpointConfig.of("127.0.0.1", 0));
        assertNotEquals(0, bound.port());

        try (StreamSource client = transport.connect(EndpointConfig.of("127.0.0.1", bound.port()));
             StreamSource server = acceptor.accept().orElseThrow()) {

            client.write("ping".getBytes(StandardCharsets.US_ASCII));
            assertEquals("ping", readAscii(server, 4));

            server.write("pong".getBytes(StandardCharsets.US_ASCII));
            assertEquals("pong", readAscii(client, 4));

            assertEquals(client.localEndpoint(), server.remoteEndpoint());
            assertEquals(bound.port(), client.remoteEndpoint().port());
        }
    }

    @Test
    void closedPeerReadsAsEndOfStream() throws Exception
    {
        Endpoint bound = acceptor.bind(EndpointConfig.of("127.0.0.1", 0));
        StreamSource client = transport.connect(EndpointConfig.of("127.0.0.1", bound.port()));
        try (StreamSource server = acceptor.accept().orElseThrow()) {
            client.close();
            assertFalse(client.isOpen());
            assertEquals(-1, server.read(new byte[8], 0, 8));
        }
    }

    @Test
    void readTimeoutFromListenConfigAppliesToAcceptedStreams() throws Exception
    {
        Endpoint bound = acceptor.bind(EndpointConfig.builder()
                .withHost("127.0.0.1")
                .withPort(0)
                .withReadTimeoutMillis(50)
                .build());

        try (StreamSource client = transport.connect(EndpointConfig.of("127.0.0.1", bound.port()));
             StreamSource server = acceptor.accept().orElseThrow()) {
            assertThrows(SocketTimeoutException.class, () -> server.read(new byte[1], 0, 1));
            assertTrue(client.isOpen());
        }
    }

    @Test
    void stopReleasesBlockedAccept() throws Exception
    {
        acceptor.bind(EndpointConfig.of("127.0.0.1", 0));
        CompletableFuture<Optional<StreamSource>> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return acceptor.accept();
            }
            catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);

        acceptor.stop();

        assertEquals(Optional.empty(), pending.get(1, TimeUnit.SECONDS));
        assertTrue(acceptor.isStopped());
        assertEquals(Optional.empty(), acceptor.accept());
    }

    @Test
    void writeAfterCloseFails() throws Exception
    {
        Endpoint bound = acceptor.bind(EndpointConfig.of("127.0.0.1", 0));
        StreamSource client = transport.connect(EndpointConfig.of("127.0.0.1", bound.port()));
        client.close();
        client.close();

        assertThrows(SocketException.class, () -> client.write(new byte[] { 1 }));
    }

    @Test
    void connectRequiresConcretePort()
    {
        assertThrows(IllegalArgumentException.class, () -> transport.connect(EndpointConfig.of("127.0.0.1", 0)));
    }

    private static String readAscii(StreamSource source, int length) throws Exception
    {
        byte[] buf = new byte[length];
        int total = 0;
        while (total < length) {
            int n = source.read(buf, total, length - total);
            assertTrue(n > 0, "unexpected end of stream");
            total += n;
        }
        return new String(buf, StandardCharsets.US_ASCII);
    }
}
