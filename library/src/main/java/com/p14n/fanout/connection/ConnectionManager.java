package com.p14n.fanout.connection;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.broker.AsyncExecutor;
import com.p14n.fanout.codec.WireMessageCodec;
import com.p14n.fanout.data.ConnectionConfig;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.exception.FanoutException;
import com.p14n.fanout.exception.MalformedMessageException;
import com.p14n.fanout.exception.NotConnectedException;
import com.p14n.fanout.exception.TerminalConnectionException;
import com.p14n.fanout.exception.TransientConnectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one real-time connection open and recovers it after unclean closes.
 *
 * <p>
 * State transitions:
 * </p>
 * <ul>
 * <li>{@code DISCONNECTED -> CONNECTING} on {@link #connect()}</li>
 * <li>{@code CONNECTING -> CONNECTED} when the transport opens, or back to
 * {@code DISCONNECTED} if it fails to</li>
 * <li>{@code CONNECTED -> RECONNECTING} on an unclean close or transport
 * error; attempt {@code n} is made after {@code baseDelay * 2^(n-1)}</li>
 * <li>{@code RECONNECTING -> DISCONNECTED} once the configured attempts are
 * used up ({@link ConnectionStatus#TERMINATED})</li>
 * <li>any state {@code -> DISCONNECTED} on a clean close (code 1000) or
 * {@link #disconnect()}</li>
 * </ul>
 *
 * <p>
 * Inbound frames are decoded and handed to every handler registered for the
 * message type. Reconnect timers run on the supplied {@link AsyncExecutor},
 * which the manager does not own.
 * </p>
 */
public class ConnectionManager implements RealtimeMessaging, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    static final int INTERNAL_ERROR = 1011;

    static final String ACTION = "action";
    static final String ROOM = "room";
    static final String JOIN_ROOM = "join_room";
    static final String LEAVE_ROOM = "leave_room";

    private final ConnectionConfig config;
    private final Transport transport;
    private final AsyncExecutor scheduler;
    private final Clock clock;
    private final Supplier<String> idSupplier;
    private final ReconnectionPolicy policy;

    private final Map<MessageType, Set<MessageHandler>> handlers = new ConcurrentHashMap<>();
    private final Set<ConnectionListener> listeners = new CopyOnWriteArraySet<>();

    // guarded by this
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private TransportSession session;
    private CompletableFuture<Void> pendingConnect;
    private ScheduledFuture<?> reconnectTimer;
    private boolean closedByClient;
    private long generation;

    public ConnectionManager(ConnectionConfig config, Transport transport, AsyncExecutor scheduler) {
        this(config, transport, scheduler, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public ConnectionManager(ConnectionConfig config, Transport transport, AsyncExecutor scheduler, Clock clock,
            Supplier<String> idSupplier) {
        this.config = config;
        this.transport = transport;
        this.scheduler = scheduler;
        this.clock = clock;
        this.idSupplier = idSupplier;
        this.policy = ReconnectionPolicy.from(config);
    }

    /**
     * Opens the connection.
     *
     * @return completes once the transport is open; fails with
     *         {@link TransientConnectionException} if it cannot be opened, or
     *         with {@link IllegalStateException} if an attempt is already in
     *         flight
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> result;
        synchronized (this) {
            if (state == ConnectionState.CONNECTED) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECTING) {
                return CompletableFuture.failedFuture(new IllegalStateException("Connection already in progress"));
            }
            state = ConnectionState.CONNECTING;
            closedByClient = false;
            policy.reset();
            pendingConnect = new CompletableFuture<>();
            result = pendingConnect;
        }
        logger.atInfo().addArgument(config.url()).log("Connecting to {}");
        openSession();
        return result;
    }

    private void openSession() {
        long attemptGeneration;
        synchronized (this) {
            attemptGeneration = ++generation;
        }
        URI endpoint = config.endpoint();
        CompletableFuture<TransportSession> opening;
        try {
            opening = transport.open(endpoint, new SessionListener(attemptGeneration));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((opened, error) -> {
            if (error != null) {
                onOpenFailed(attemptGeneration, unwrap(error));
            } else {
                onOpened(attemptGeneration, opened);
            }
        });
    }

    private void onOpened(long attemptGeneration, TransportSession opened) {
        CompletableFuture<Void> completed = null;
        boolean accepted;
        synchronized (this) {
            accepted = attemptGeneration == generation && !closedByClient;
            if (accepted) {
                session = opened;
                state = ConnectionState.CONNECTED;
                policy.recordSuccess();
                completed = pendingConnect;
                pendingConnect = null;
            }
        }
        if (!accepted) {
            logger.atDebug().log("Closing session opened after it was abandoned");
            opened.close(TransportSession.NORMAL_CLOSURE, "Abandoned");
            return;
        }
        logger.atInfo().addArgument(config.url()).log("Connected to {}");
        notifyListeners(ConnectionStatus.CONNECTED, null);
        if (completed != null) {
            completed.complete(null);
        }
    }

    private void onOpenFailed(long attemptGeneration, Throwable error) {
        CompletableFuture<Void> failed = null;
        boolean retry = false;
        synchronized (this) {
            if (attemptGeneration != generation) {
                return;
            }
            if (state == ConnectionState.CONNECTING) {
                state = ConnectionState.DISCONNECTED;
                failed = pendingConnect;
                pendingConnect = null;
            } else if (state == ConnectionState.RECONNECTING) {
                retry = true;
            }
        }
        var cause = new TransientConnectionException("Failed to open connection to " + config.url(), error);
        logger.atWarn()
                .addArgument(config.url())
                .setCause(error)
                .log("Failed to open connection to {}");
        notifyListeners(ConnectionStatus.ERROR, cause);
        if (failed != null) {
            failed.completeExceptionally(cause);
        }
        if (retry) {
            scheduleReconnect();
        }
    }

    private void onClosed(long sessionGeneration, int code, String reason) {
        onClosed(sessionGeneration, code, reason, false);
    }

    /**
     * @param failed the session reported an error and may still be open; it is
     *               closed here so it neither leaks nor delivers further frames
     */
    private void onClosed(long sessionGeneration, int code, String reason, boolean failed) {
        boolean reconnect;
        TransportSession dropped;
        synchronized (this) {
            if (sessionGeneration != generation || state != ConnectionState.CONNECTED) {
                return;
            }
            dropped = session;
            session = null;
            generation++;
            reconnect = code != TransportSession.NORMAL_CLOSURE && !closedByClient;
            state = reconnect ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED;
        }
        if (failed && dropped != null) {
            closeQuietly(dropped, INTERNAL_ERROR, "Transport error");
        }
        if (!reconnect) {
            logger.atInfo().addArgument(config.url()).log("Connection to {} closed");
            notifyListeners(ConnectionStatus.DISCONNECTED, null);
            return;
        }
        logger.atWarn()
                .addArgument(config.url())
                .addArgument(code)
                .addArgument(reason)
                .log("Connection to {} closed uncleanly ({} {})");
        notifyListeners(ConnectionStatus.DISCONNECTED,
                new TransientConnectionException("Connection closed with code " + code + ": " + reason));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        TerminalConnectionException terminal = null;
        Duration delay = null;
        int attempt = 0;
        synchronized (this) {
            if (closedByClient) {
                return;
            }
            if (!policy.shouldRetry()) {
                state = ConnectionState.DISCONNECTED;
                terminal = new TerminalConnectionException(policy.getAttemptCount());
            } else {
                delay = policy.recordAttempt();
                attempt = policy.getAttemptCount();
                state = ConnectionState.RECONNECTING;
                try {
                    reconnectTimer = scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    logger.atWarn().setCause(e).log("Reconnect scheduler rejected the attempt");
                    state = ConnectionState.DISCONNECTED;
                    terminal = new TerminalConnectionException(attempt);
                }
            }
        }
        if (terminal != null) {
            logger.atError()
                    .addArgument(config.url())
                    .addArgument(terminal.getAttempts())
                    .log("Giving up on {} after {} reconnect attempts");
            notifyListeners(ConnectionStatus.TERMINATED, terminal);
            return;
        }
        logger.atInfo()
                .addArgument(attempt)
                .addArgument(policy.getMaxAttempts())
                .addArgument(delay.toMillis())
                .log("Reconnect attempt {}/{} in {}ms");
        notifyListeners(ConnectionStatus.RECONNECTING, null);
    }

    private void reconnect() {
        synchronized (this) {
            reconnectTimer = null;
            if (state != ConnectionState.RECONNECTING || closedByClient) {
                return;
            }
        }
        openSession();
    }

    /**
     * Closes the connection cleanly. Pending reconnects are cancelled and no
     * further attempts are made until {@link #connect()} is called again.
     */
    public void disconnect() {
        TransportSession toClose;
        ScheduledFuture<?> timer;
        CompletableFuture<Void> pending;
        boolean wasActive;
        synchronized (this) {
            closedByClient = true;
            wasActive = state != ConnectionState.DISCONNECTED;
            state = ConnectionState.DISCONNECTED;
            toClose = session;
            session = null;
            timer = reconnectTimer;
            reconnectTimer = null;
            pending = pendingConnect;
            pendingConnect = null;
            generation++;
        }
        if (timer != null) {
            timer.cancel(false);
        }
        if (toClose != null) {
            toClose.close(TransportSession.NORMAL_CLOSURE, "Client disconnect");
        }
        if (pending != null) {
            pending.completeExceptionally(new CancellationException("Disconnected before the connection opened"));
        }
        if (wasActive) {
            logger.atInfo().addArgument(config.url()).log("Disconnected from {}");
            notifyListeners(ConnectionStatus.DISCONNECTED, null);
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    @Override
    public WireMessage send(OutboundMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        TransportSession current;
        synchronized (this) {
            if (state != ConnectionState.CONNECTED || session == null) {
                throw new NotConnectedException(state);
            }
            current = session;
        }
        WireMessage wire = WireMessage.stamp(message, idSupplier.get(), clock.instant());
        current.send(WireMessageCodec.encode(wire));
        logger.atTrace()
                .addArgument(wire.type().wireName())
                .addArgument(wire.id())
                .log("Sent {} message {}");
        return wire;
    }

    @Override
    public WireMessage joinRoom(String room) {
        return send(OutboundMessage.of(MessageType.UPDATE, roomAction(JOIN_ROOM, room)));
    }

    @Override
    public WireMessage leaveRoom(String room) {
        return send(OutboundMessage.of(MessageType.UPDATE, roomAction(LEAVE_ROOM, room)));
    }

    private static ObjectNode roomAction(String action, String room) {
        if (room == null || room.trim().isEmpty()) {
            throw new IllegalArgumentException("Room cannot be null or empty");
        }
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put(ACTION, action);
        data.put(ROOM, room);
        return data;
    }

    @Override
    public Subscription subscribeToType(MessageType type, MessageHandler handler) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArraySet<>()).add(handler);
        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                if (active.compareAndSet(true, false)) {
                    unsubscribeFromType(type, handler);
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    /**
     * Removes every handler registered for a type.
     */
    public void unsubscribeFromType(MessageType type) {
        handlers.remove(type);
    }

    /**
     * Removes one handler of a type.
     */
    public void unsubscribeFromType(MessageType type, MessageHandler handler) {
        handlers.computeIfPresent(type, (t, set) -> {
            set.remove(handler);
            return set.isEmpty() ? null : set;
        });
    }

    public Subscription onConnectionChange(ConnectionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                if (active.compareAndSet(true, false)) {
                    listeners.remove(listener);
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public int getReconnectAttempts() {
        return policy.getAttemptCount();
    }

    private void dispatch(WireMessage message) {
        Set<MessageHandler> typeHandlers = handlers.get(message.type());
        if (typeHandlers == null) {
            logger.atDebug()
                    .addArgument(message.type().wireName())
                    .log("No handler for {} message");
            return;
        }
        for (MessageHandler handler : typeHandlers) {
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(message.type().wireName())
                        .addArgument(message.id())
                        .setCause(e)
                        .log("Handler failed on {} message {}");
            }
        }
    }

    private void notifyListeners(ConnectionStatus status, FanoutException cause) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionChange(status, cause);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(status)
                        .setCause(e)
                        .log("Connection listener failed on {}");
            }
        }
    }

    private static void closeQuietly(TransportSession dropped, int code, String reason) {
        try {
            dropped.close(code, reason);
        } catch (RuntimeException e) {
            logger.atDebug()
                    .addArgument(code)
                    .setCause(e)
                    .log("Failed to close dropped session with {}");
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private class SessionListener implements TransportListener {

        private final long sessionGeneration;

        SessionListener(long sessionGeneration) {
            this.sessionGeneration = sessionGeneration;
        }

        private boolean current() {
            synchronized (ConnectionManager.this) {
                return sessionGeneration == generation;
            }
        }

        @Override
        public void onText(String text) {
            if (!current()) {
                return;
            }
            WireMessage message;
            try {
                message = WireMessageCodec.decode(text);
            } catch (MalformedMessageException e) {
                logger.atWarn()
                        .setCause(e)
                        .log("Dropping malformed inbound message");
                return;
            }
            dispatch(message);
        }

        @Override
        public void onClose(int code, String reason) {
            onClosed(sessionGeneration, code, reason);
        }

        @Override
        public void onError(Throwable error) {
            if (!current()) {
                return;
            }
            logger.atWarn()
                    .addArgument(config.url())
                    .setCause(error)
                    .log("Transport error on {}");
            notifyListeners(ConnectionStatus.ERROR,
                    new TransientConnectionException("Transport error on " + config.url(), error));
            onClosed(sessionGeneration, TransportSession.ABNORMAL_CLOSURE, error.getMessage(), true);
        }
    }
}
