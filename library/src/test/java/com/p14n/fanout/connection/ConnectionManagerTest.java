package com.p14n.fanout.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.broker.TestAsyncExecutor;
import com.p14n.fanout.data.ConnectionConfig;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.exception.NotConnectedException;
import com.p14n.fanout.exception.TerminalConnectionException;
import com.p14n.fanout.exception.TransientConnectionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class ConnectionManagerTest {

    private static final Instant NOW = Instant.parse("2024-10-27T22:11:07Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeTransport transport;
    private TestAsyncExecutor scheduler;
    private ConnectionManager manager;
    private List<ConnectionStatus> statuses;
    private AtomicInteger ids;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        scheduler = new TestAsyncExecutor();
        ids = new AtomicInteger();
        manager = new ConnectionManager(
                new ConnectionConfig("ws://localhost/ws", "secret", Duration.ofSeconds(1), 5),
                transport, scheduler, Clock.fixed(NOW, ZoneOffset.UTC), () -> "msg-" + ids.incrementAndGet());
        statuses = new CopyOnWriteArrayList<>();
        manager.onConnectionChange((status, cause) -> statuses.add(status));
    }

    private FakeTransport.FakeSession connected() throws Exception {
        CompletableFuture<Void> connecting = manager.connect();
        FakeTransport.FakeSession session = transport.last().open();
        connecting.get();
        return session;
    }

    @Test
    void connectOpensTheEndpointWithToken() throws Exception {
        connected();

        assertEquals("ws://localhost/ws?token=secret", transport.last().endpoint.toString());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals(List.of(ConnectionStatus.CONNECTED), statuses);
    }

    @Test
    void connectWhileInFlightFailsImmediately() {
        manager.connect();

        CompletableFuture<Void> second = manager.connect();

        var thrown = assertThrows(ExecutionException.class, second::get);
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        assertEquals("Connection already in progress", thrown.getCause().getMessage());
        assertEquals(1, transport.attempts.size());
    }

    @Test
    void connectWhenConnectedCompletesImmediately() throws Exception {
        connected();

        assertTrue(manager.connect().isDone());
        assertEquals(1, transport.attempts.size());
    }

    @Test
    void failedInitialOpenFailsConnectWithoutRetrying() {
        CompletableFuture<Void> connecting = manager.connect();
        transport.last().fail("refused");

        var thrown = assertThrows(ExecutionException.class, connecting::get);
        assertInstanceOf(TransientConnectionException.class, thrown.getCause());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(0, scheduler.scheduledCount());
        assertEquals(List.of(ConnectionStatus.ERROR), statuses);
    }

    @Test
    void sendStampsIdAndTimestamp() throws Exception {
        FakeTransport.FakeSession session = connected();

        WireMessage sent = manager.send(OutboundMessage.of(MessageType.CHAT,
                JsonNodeFactory.instance.objectNode().put("content", "hi")));

        assertEquals("msg-1", sent.id());
        assertEquals(NOW, sent.timestamp());
        var frame = mapper.readTree(session.sent.get(0));
        assertEquals("msg-1", frame.get("id").asText());
        assertEquals("chat", frame.get("type").asText());
        assertEquals("hi", frame.get("data").get("content").asText());
        assertEquals(NOW.toString(), frame.get("timestamp").asText());
    }

    @Test
    void sendFailsUnlessConnected() throws Exception {
        OutboundMessage message = OutboundMessage.of(MessageType.CHAT, null);

        var idle = assertThrows(NotConnectedException.class, () -> manager.send(message));
        assertEquals(ConnectionState.DISCONNECTED, idle.getState());

        manager.connect();
        var connecting = assertThrows(NotConnectedException.class, () -> manager.send(message));
        assertEquals(ConnectionState.CONNECTING, connecting.getState());

        transport.last().open();
        manager.disconnect();
        assertThrows(NotConnectedException.class, () -> manager.send(message));
    }

    @Test
    void reconnectDelaysDoubleUntilAttemptsRunOut() throws Exception {
        AtomicReference<Throwable> terminalCause = new AtomicReference<>();
        manager.onConnectionChange((status, cause) -> {
            if (status == ConnectionStatus.TERMINATED) {
                terminalCause.set(cause);
            }
        });
        connected();

        transport.last().listener.onClose(1006, "gone");
        assertEquals(ConnectionState.RECONNECTING, manager.getState());

        for (int attempt = 1; attempt <= 5; attempt++) {
            assertEquals(attempt, manager.getReconnectAttempts());
            assertTrue(scheduler.runNextScheduled());
            transport.last().fail("still down");
        }

        assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16000L), scheduler.scheduledDelays());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(0, scheduler.scheduledCount());
        assertEquals(6, transport.attempts.size());
        assertInstanceOf(TerminalConnectionException.class, terminalCause.get());
        assertEquals(5, ((TerminalConnectionException) terminalCause.get()).getAttempts());
        assertEquals(ConnectionStatus.TERMINATED, statuses.get(statuses.size() - 1));
    }

    @Test
    void successfulReconnectResetsAttempts() throws Exception {
        connected();
        transport.last().listener.onClose(1006, "gone");

        scheduler.runNextScheduled();
        transport.last().fail("down");
        scheduler.runNextScheduled();
        transport.last().open();

        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals(0, manager.getReconnectAttempts());
        assertEquals(List.of(1000L, 2000L), scheduler.scheduledDelays());
    }

    @Test
    void cleanCloseDoesNotReconnect() throws Exception {
        connected();

        transport.last().listener.onClose(1000, "bye");

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(0, scheduler.scheduledCount());
        assertEquals(ConnectionStatus.DISCONNECTED, statuses.get(statuses.size() - 1));
    }

    @Test
    void transportErrorTriggersReconnect() throws Exception {
        connected();

        transport.last().listener.onError(new IOException("reset"));

        assertEquals(ConnectionState.RECONNECTING, manager.getState());
        assertEquals(1, scheduler.scheduledCount());
        assertTrue(statuses.contains(ConnectionStatus.ERROR));
    }

    @Test
    void transportErrorClosesTheFailedSession() throws Exception {
        FakeTransport.FakeSession failed = connected();
        TransportListener failedListener = transport.last().listener;
        List<WireMessage> received = new CopyOnWriteArrayList<>();
        manager.subscribeToType(MessageType.NOTIFICATION, received::add);

        failedListener.onError(new IOException("boom"));

        assertEquals(ConnectionManager.INTERNAL_ERROR, failed.closeCode);
        assertEquals(ConnectionState.RECONNECTING, manager.getState());

        failedListener.onText("{\"type\":\"notification\",\"data\":{\"title\":\"late\"}}");
        assertTrue(received.isEmpty());

        assertTrue(scheduler.runNextScheduled());
        transport.last().open();
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    void disconnectCancelsPendingReconnect() throws Exception {
        connected();
        transport.last().listener.onClose(1006, "gone");
        assertEquals(1, scheduler.scheduledCount());

        manager.disconnect();

        assertEquals(0, scheduler.scheduledCount());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertFalse(scheduler.runNextScheduled());
    }

    @Test
    void disconnectClosesCleanly() throws Exception {
        FakeTransport.FakeSession session = connected();

        manager.disconnect();

        assertEquals(1000, session.closeCode);
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());

        // the transport's own close callback arrives late and is ignored
        transport.last().listener.onClose(1000, "bye");
        assertEquals(0, scheduler.scheduledCount());
    }

    @Test
    void everyHandlerOfATypeIsCalled() throws Exception {
        connected();
        List<String> calls = new CopyOnWriteArrayList<>();
        manager.subscribeToType(MessageType.NOTIFICATION, m -> calls.add("a:" + m.id()));
        manager.subscribeToType(MessageType.NOTIFICATION, m -> {
            throw new IllegalStateException("boom");
        });
        manager.subscribeToType(MessageType.NOTIFICATION, m -> calls.add("b:" + m.id()));
        manager.subscribeToType(MessageType.CHAT, m -> calls.add("chat"));

        transport.last().listener.onText("{\"id\":\"n1\",\"type\":\"notification\",\"data\":{}}");

        assertEquals(List.of("a:n1", "b:n1"), calls);
    }

    @Test
    void unsubscribedHandlersStopReceiving() throws Exception {
        connected();
        AtomicInteger calls = new AtomicInteger();
        Subscription one = manager.subscribeToType(MessageType.CHAT, m -> calls.incrementAndGet());
        manager.subscribeToType(MessageType.CHAT, m -> calls.incrementAndGet());

        one.unsubscribe();
        transport.last().listener.onText("{\"type\":\"chat\",\"data\":{}}");
        assertEquals(1, calls.get());

        manager.unsubscribeFromType(MessageType.CHAT);
        transport.last().listener.onText("{\"type\":\"chat\",\"data\":{}}");
        assertEquals(1, calls.get());
    }

    @Test
    void malformedInboundFramesAreDropped() throws Exception {
        connected();
        AtomicInteger calls = new AtomicInteger();
        manager.subscribeToType(MessageType.CHAT, m -> calls.incrementAndGet());

        transport.last().listener.onText("not json");
        transport.last().listener.onText("{\"type\":\"shout\"}");
        transport.last().listener.onText("{\"type\":\"chat\"}");

        assertEquals(1, calls.get());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    void joinAndLeaveRoomSendControlMessages() throws Exception {
        FakeTransport.FakeSession session = connected();

        manager.joinRoom("board");
        manager.leaveRoom("board");

        var join = mapper.readTree(session.sent.get(0));
        assertEquals("update", join.get("type").asText());
        assertEquals("join_room", join.get("data").get("action").asText());
        assertEquals("board", join.get("data").get("room").asText());
        var leave = mapper.readTree(session.sent.get(1));
        assertEquals("leave_room", leave.get("data").get("action").asText());
    }

    @Test
    void connectAgainAfterTermination() throws Exception {
        connected();
        transport.last().listener.onClose(1006, "gone");
        for (int attempt = 1; attempt <= 5; attempt++) {
            scheduler.runNextScheduled();
            transport.last().fail("down");
        }
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());

        connected();

        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals(0, manager.getReconnectAttempts());
    }
}
