package org.csdt.adinkra.ipc.transport.netty;

import org.csdt.adinkra.ipc.config.IpcChannelConfig;
import org.csdt.adinkra.ipc.config.ServingMode;
import org.csdt.adinkra.ipc.lifecycle.ShutdownContext;
import org.csdt.adinkra.ipc.observability.IpcConnectionEvent;
import org.csdt.adinkra.ipc.observability.IpcLifecycleEvent;
import org.csdt.adinkra.ipc.observability.RecordingObservabilitySink;
import org.csdt.adinkra.ipc.transport.Await;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;
import org.csdt.adinkra.ipc.transport.ChannelSetupException;
import org.csdt.adinkra.ipc.transport.LoopbackClient;
import org.csdt.adinkra.ipc.transport.RecordingRequestHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.csdt.adinkra.ipc.transport.LoopbackClient.end;
import static org.csdt.adinkra.ipc.transport.LoopbackClient.request;
import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyChannelServerTest
 * -----------------------------------------------------------------------------
 * Loopback tests for the concurrent (Netty) channel server.
 *
 * <p>The wire behaviour must be indistinguishable from the sequential server
 * for a single client; with several clients, connections are served side by
 * side.</p>
 */
final class NettyChannelServerTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ShutdownContext context = new ShutdownContext();

    private NettyChannelServer server;
    private Thread serveThread;

    @AfterEach
    void shutdown() throws InterruptedException
    {
        context.close();
        if (serveThread != null) {
            serveThread.join(5_000);
            assertFalse(serveThread.isAlive(), "serve did not return");
        }
    }

    @Test
    void singleRequestIsDeliveredAndAnswered() throws Exception
    {
        RecordingRequestHandler handler = start(config().build(), true);

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send(request("{\"a\":1}"));

            assertEquals("REQUESTCOMPLETE", client.readLine());
            assertEquals("stl:{\"a\":1}", client.readLine());

            client.send(end());
            assertTrue(client.awaitServerClose());
        }

        assertEquals("{\"a\":1}", handler.nextBody());
        Await.until("connection closed event",
                () -> sink.connectionEvents(IpcConnectionEvent.Kind.CLOSED).size() == 1);
    }

    @Test
    void finalPayloadIsFlushedBeforeClose() throws Exception
    {
        RecordingRequestHandler handler = start(config().build(), true);

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send(request("x") + "BEGINTRANSMISSION\r\ntail\r\n" + end());

            assertEquals("REQUESTCOMPLETE", client.readLine());
            assertEquals("stl:x", client.readLine());
            assertEquals("REQUESTCOMPLETE", client.readLine());
            assertEquals("stl:tail", client.readLine());
            assertTrue(client.awaitServerClose());
        }

        assertEquals("x", handler.nextBody());
        assertEquals("tail", handler.nextBody());
    }

    @Test
    void connectionsAreServedConcurrently() throws Exception
    {
        RecordingRequestHandler handler = start(config().build(), false);

        try (LoopbackClient first = LoopbackClient.connect(server.localAddress());
             LoopbackClient second = LoopbackClient.connect(server.localAddress())) {

            first.send(request("from-first"));
            assertEquals("from-first", handler.nextBody());

            // The first connection is still open; the second is not held back.
            second.send(request("from-second") + end());
            assertEquals("from-second", handler.nextBody());
            assertTrue(second.awaitServerClose());

            first.send(end());
            assertTrue(first.awaitServerClose());
        }
    }

    @Test
    void orderIsPreservedWithinEachConnection() throws Exception
    {
        RecordingRequestHandler handler = start(config().build(), false);

        List<LoopbackClient> clients = new ArrayList<>();
        try {
            for (int c = 0; c < 3; c++) {
                clients.add(LoopbackClient.connect(server.localAddress()));
            }
            for (int c = 0; c < clients.size(); c++) {
                StringBuilder wire = new StringBuilder();
                for (int i = 1; i <= 5; i++) {
                    wire.append(request(c + ":" + i));
                }
                clients.get(c).send(wire.append(end()).toString());
            }
            for (LoopbackClient client : clients) {
                assertTrue(client.awaitServerClose());
            }
        } finally {
            for (LoopbackClient client : clients) {
                client.close();
            }
        }

        int[] lastSeen = new int[3];
        Set<Long> connections = new HashSet<>();
        for (int n = 0; n < 15; n++) {
            RecordingRequestHandler.Delivery d = handler.poll(5_000);
            assertNotNull(d);
            connections.add(d.connectionId());
            String[] parts = d.payload().body().split(":");
            int client = Integer.parseInt(parts[0]);
            int index = Integer.parseInt(parts[1]);
            assertEquals(lastSeen[client] + 1, index, "payloads of client " + client + " out of order");
            assertEquals(index, d.payload().sequence());
            lastSeen[client] = index;
        }
        assertEquals(3, connections.size());
    }

    @Test
    void disconnectBeforeEndIsReportedAsFramingError() throws Exception
    {
        RecordingRequestHandler handler = start(config().build(), false);

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send("BEGINTRANSMISSION\r\nhalf\r\n");
        }

        Await.until("aborted event", () -> !sink.connectionEvents(IpcConnectionEvent.Kind.ABORTED).isEmpty());
        assertTrue(sink.getErrors().stream().anyMatch(e -> e.message().startsWith("framing error:")));
        assertNull(handler.poll(100));
    }

    @Test
    void idleConnectionTimesOut() throws Exception
    {
        start(config().withReadTimeout(Duration.ofMillis(200)).build(), false);

        try (LoopbackClient idle = LoopbackClient.connect(server.localAddress())) {
            assertTrue(idle.awaitServerClose());
        }

        Await.until("aborted event", () -> !sink.connectionEvents(IpcConnectionEvent.Kind.ABORTED).isEmpty());
        assertTrue(sink.getErrors().stream().anyMatch(e -> e.message().equals("read timed out")));
    }

    @Test
    void slowHandlerDoesNotCountAgainstReadTimeout() throws Exception
    {
        start(config().withReadTimeout(Duration.ofMillis(200)).build(), (connection, payload) -> {
            sleepQuietly(800);
            try {
                connection.send("REQUESTCOMPLETE\r\n".getBytes(StandardCharsets.US_ASCII));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send(request("slow"));
            assertEquals("REQUESTCOMPLETE", client.readLine());

            client.send(request("slow-again"));
            assertEquals("REQUESTCOMPLETE", client.readLine());

            client.send(end());
            assertTrue(client.awaitServerClose());
        }

        Await.until("connection closed event",
                () -> sink.connectionEvents(IpcConnectionEvent.Kind.CLOSED).size() == 1);
        assertTrue(sink.getErrors().isEmpty(), () -> sink.getErrors().toString());
    }

    @Test
    void silenceAfterReplyStillTimesOut() throws Exception
    {
        start(config().withReadTimeout(Duration.ofMillis(200)).build(), true);

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send(request("once"));
            assertEquals("REQUESTCOMPLETE", client.readLine());
            assertEquals("stl:once", client.readLine());

            assertTrue(client.awaitServerClose());
        }

        Await.until("aborted event", () -> !sink.connectionEvents(IpcConnectionEvent.Kind.ABORTED).isEmpty());
        assertTrue(sink.getErrors().stream().anyMatch(e -> e.message().equals("read timed out")));
    }

    @Test
    void oversizedLineIsReportedAsFramingError() throws Exception
    {
        RecordingRequestHandler handler = start(config().withMaxLineLength(16).build(), false);

        try (LoopbackClient client = LoopbackClient.connect(server.localAddress())) {
            client.send("BEGINTRANSMISSION\r\n" + "x".repeat(64) + "\r\n");
            assertTrue(client.awaitServerClose());
        }

        Await.until("aborted event", () -> !sink.connectionEvents(IpcConnectionEvent.Kind.ABORTED).isEmpty());
        assertEquals(1, sink.getErrors().size());
        assertEquals("framing error: line exceeds 16 bytes", sink.getErrors().get(0).message());
        assertNull(handler.poll(100));
    }

    @Test
    void portInUseFailsSetup() throws Exception
    {
        try (ServerSocket occupied = new ServerSocket()) {
            occupied.bind(new InetSocketAddress("127.0.0.1", 0));
            server = new NettyChannelServer(config().withPort(occupied.getLocalPort()).build(), context, sink);

            assertThrows(ChannelSetupException.class, server::bind);
            assertEquals(1, sink.getErrors().size());
        }
    }

    @Test
    void closingContextReleasesServe() throws Exception
    {
        start(config().build(), false);

        context.close();
        serveThread.join(5_000);

        assertFalse(serveThread.isAlive());
        assertTrue(sink.eventsOfType(IpcLifecycleEvent.class).stream()
                .anyMatch(e -> e.phase() == IpcLifecycleEvent.Phase.SHUTDOWN));
    }

    private static IpcChannelConfig.Builder config()
    {
        return IpcChannelConfig.builder()
                .withPort(0)
                .withServingMode(ServingMode.CONCURRENT);
    }

    private RecordingRequestHandler start(IpcChannelConfig config, boolean respond)
    {
        RecordingRequestHandler handler = new RecordingRequestHandler(respond);
        start(config, handler);
        return handler;
    }

    private void start(IpcChannelConfig config, ChannelRequestHandler handler)
    {
        server = new NettyChannelServer(config, context, sink);
        server.bind();

        serveThread = new Thread(() -> server.serve(handler), "netty-server-test");
        serveThread.start();
    }

    private static void sleepQuietly(long millis)
    {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
