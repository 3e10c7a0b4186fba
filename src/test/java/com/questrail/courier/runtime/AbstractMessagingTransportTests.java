package com.questrail.courier.runtime;

import com.questrail.courier.codec.impl.DefaultMessageFrameDecoder;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.config.ServiceRegistry;
import com.questrail.courier.connection.ConnectionHandle;
import com.questrail.courier.connection.RecordingMessageHandler;
import com.questrail.courier.error.PayloadTooLargeException;
import com.questrail.courier.error.ReadTimeoutException;
import com.questrail.courier.error.TransportException;
import com.questrail.courier.model.KeyValueMessage;
import com.questrail.courier.model.Message;
import com.questrail.courier.model.RawStringMessage;
import com.questrail.courier.observability.ConnectionEvent;
import com.questrail.courier.observability.RecordingObservabilitySink;
import com.questrail.courier.transport.StreamTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AbstractMessagingTransportTests
 * -----------------------------------------------------------------------------
 * End-to-end behaviour of {@link Messaging} over real loopback connections.
 * Each transport implementation runs the same scenarios through a subclass.
 */
abstract class AbstractMessagingTransportTests
{
    protected static final Duration WAIT = Duration.ofSeconds(5);
    protected static final String HOST = "127.0.0.1";

    protected final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    protected Messaging messaging;

    protected abstract StreamTransport newTransport();

    @BeforeEach
    void createMessaging()
    {
        messaging = Messaging.builder()
                .withTransport(newTransport())
                .withObservabilitySink(sink)
                .build();
    }

    @AfterEach
    void closeMessaging()
    {
        messaging.close();
    }

    @Test
    void keyValueMessageArrivesIntact() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        client.send(KeyValueMessage.builder()
                .put("user", "alice")
                .put("action", "login")
                .build());

        KeyValueMessage received = (KeyValueMessage) handler.next(WAIT);
        assertEquals(Map.of("user", "alice", "action", "login"), received.entries());
    }

    @Test
    void rawStringArrivesIntact() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        client.send(Message.newRawMessage("<xml>ok</xml>"));

        assertEquals(Message.newRawMessage("<xml>ok</xml>"), handler.next(WAIT));
    }

    @Test
    void messagesOnOneConnectionArriveInSendOrder() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        for (int i = 0; i < 100; i++) {
            client.send(Message.newRawMessage("m" + i));
        }
        for (int i = 0; i < 100; i++) {
            assertEquals("m" + i, ((RawStringMessage) handler.next(WAIT)).text());
        }
    }

    @Test
    void connectionsAreIndependent() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        int port = server.localEndpoint().port();
        ConnectionHandle first = messaging.connect(HOST, port);
        ConnectionHandle second = messaging.connect(HOST, port);

        first.close();
        second.send(Message.newRawMessage("second still works"));

        assertEquals(Message.newRawMessage("second still works"), handler.next(WAIT));
        assertTrue(second.isOpen());
    }

    @Test
    void requestReceivesReply() throws Exception
    {
        ListenerHandle server = messaging.listen(HOST, 0, (message, connection) -> {
            KeyValueMessage kv = (KeyValueMessage) message;
            connection.send(KeyValueMessage.builder()
                    .put("status", "ok")
                    .put("user", kv.get("user"))
                    .build());
        });
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        KeyValueMessage reply = (KeyValueMessage) client.request(
                Message.newKeyValueMessage(Map.of("user", "alice")), WAIT);

        assertEquals("ok", reply.get("status"));
        assertEquals("alice", reply.get("user"));
    }

    @Test
    void largeMessageSurvivesSegmentation() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        String big = "0123456789abcdef".repeat(64 * 1024);
        client.send(Message.newRawMessage(big));
        client.send(Message.newRawMessage("tail"));

        assertEquals(big, ((RawStringMessage) handler.next(WAIT)).text());
        assertEquals(Message.newRawMessage("tail"), handler.next(WAIT));
    }

    @Test
    void messageOverBodyLimitFailsBeforeSendingAndConnectionStaysUsable() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        try (Messaging limited = Messaging.builder()
                .withTransport(newTransport())
                .withObservabilitySink(sink)
                .withMaxInboundBodyLength(1024)
                .build()) {
            ListenerHandle server = limited.listen(HOST, 0, handler);
            ConnectionHandle client = limited.connect(HOST, server.localEndpoint().port());

            PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class,
                    () -> client.send(Message.newRawMessage("x".repeat(1025))));
            assertEquals(1024, e.maximumLength());
            assertTrue(client.isOpen());

            String largest = "x".repeat(1024);
            client.send(Message.newRawMessage(largest));
            assertEquals(largest, ((RawStringMessage) handler.next(WAIT)).text());
            assertTrue(client.isOpen());
        }
    }

    @Test
    void defaultLimitsAgreeBetweenSenderAndReceiver() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        assertThrows(PayloadTooLargeException.class, () -> client.send(
                Message.newRawMessage("x".repeat(DefaultMessageFrameDecoder.DEFAULT_MAX_BODY_LENGTH + 1))));
        assertTrue(client.isOpen());

        client.send(Message.newRawMessage("after"));
        assertEquals(Message.newRawMessage("after"), handler.next(WAIT));
        assertTrue(handler.closes.isEmpty());
    }

    @Test
    void idleInboundConnectionTimesOut() throws Exception
    {
        EndpointConfig config = EndpointConfig.builder()
                .withHost(HOST)
                .withPort(0)
                .withReadTimeoutMillis(100)
                .build();
        ListenerHandle server = messaging.listen(config, (message, connection) -> {});
        RecordingMessageHandler clientHandler = new RecordingMessageHandler();
        ConnectionHandle client = messaging.connect(EndpointConfig.of(HOST, server.localEndpoint().port()), clientHandler);

        assertTrue(clientHandler.awaitClosed(WAIT));
        assertFalse(client.isOpen());
        awaitCondition(() -> sink.eventsOfType(ConnectionEvent.Type.CONNECTION_CLOSED).stream()
                .anyMatch(e -> e.cause().filter(ReadTimeoutException.class::isInstance).isPresent()));
    }

    @Test
    void stoppedListenerRefusesNewConnections() throws Exception
    {
        ListenerHandle server = messaging.listen(HOST, 0, (message, connection) -> {});
        int port = server.localEndpoint().port();

        server.stop();

        assertTrue(server.awaitTermination(WAIT));
        assertThrows(TransportException.class, () -> messaging.connect(HOST, port));
    }

    @Test
    void stopClosesAcceptedConnections() throws Exception
    {
        ListenerHandle server = messaging.listen(HOST, 0, (message, connection) -> {});
        RecordingMessageHandler clientHandler = new RecordingMessageHandler();
        messaging.connect(EndpointConfig.of(HOST, server.localEndpoint().port()), clientHandler);
        awaitCondition(() -> server.connectionCount() == 1);

        server.stop();

        assertTrue(clientHandler.awaitClosed(WAIT));
        assertEquals(0, server.connectionCount());
    }

    @Test
    void connectToClosedPortFails() throws Exception
    {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }

        assertThrows(TransportException.class, () -> messaging.connect(HOST, port));
    }

    @Test
    void listenOnBusyPortFails()
    {
        ListenerHandle server = messaging.listen(HOST, 0, (message, connection) -> {});

        assertThrows(TransportException.class,
                () -> messaging.listen(HOST, server.localEndpoint().port(), (message, connection) -> {}));
    }

    @Test
    void connectsToRegisteredServiceByName() throws Exception
    {
        RecordingMessageHandler handler = new RecordingMessageHandler();
        ListenerHandle server = messaging.listen(HOST, 0, handler);

        ServiceRegistry services = ServiceRegistry.builder()
                .addService("auth", HOST, server.localEndpoint().port())
                .build();
        try (Messaging clientSide = Messaging.builder()
                .withTransport(newTransport())
                .withObservabilitySink(sink)
                .withServices(services)
                .build()) {
            clientSide.connect("auth").send(Message.newRawMessage("via registry"));
            assertEquals(Message.newRawMessage("via registry"), handler.next(WAIT));
            assertThrows(IllegalArgumentException.class, () -> clientSide.connect("billing"));
        }
    }

    @Test
    void closedMessagingRejectsNewWork() throws IOException
    {
        ListenerHandle server = messaging.listen(HOST, 0, (message, connection) -> {});
        ConnectionHandle client = messaging.connect(HOST, server.localEndpoint().port());

        messaging.close();

        assertTrue(server.isStopped());
        assertFalse(client.isOpen());
        assertThrows(IllegalStateException.class, () -> messaging.connect(HOST, 1));
        assertThrows(IllegalStateException.class, () -> messaging.listen(HOST, 0, (message, connection) -> {}));
        messaging.close();
    }

    protected static void awaitCondition(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }
}
