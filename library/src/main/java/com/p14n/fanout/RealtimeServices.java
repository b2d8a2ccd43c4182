package com.p14n.fanout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.p14n.fanout.broker.ScopeBroker;
import com.p14n.fanout.connection.ConnectionManager;
import com.p14n.fanout.consumer.ChatService;
import com.p14n.fanout.consumer.CollaborationService;
import com.p14n.fanout.consumer.NotificationService;
import com.p14n.fanout.consumer.RealtimeEvents;
import com.p14n.fanout.presence.PresenceTracker;
import com.p14n.fanout.registry.ChannelRegistry;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the distribution layer together once at startup. Everything created
 * here is closed, in reverse order of creation, by {@link #close()}.
 *
 * <pre>{@code
 * try (var services = new RealtimeServices(broker, connectionManager)) {
 *     services.registry().subscribeToOrganization("42", event -> ...);
 *     services.events().publishDashboardUpdate("7", "42", metrics);
 * }
 * }</pre>
 */
public class RealtimeServices implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeServices.class);

    private final ChannelRegistry registry;
    private final PresenceTracker presence;
    private final RealtimeEvents events;
    private final ConnectionManager connection;
    private final NotificationService notifications;
    private final ChatService chat;
    private final CollaborationService collaboration;
    private final List<AutoCloseable> closeables = new ArrayList<>();

    /**
     * Creates the event side only: registry, presence and publishing helpers.
     */
    public RealtimeServices(ScopeBroker broker) {
        this(broker, null);
    }

    /**
     * Creates the event side and, when a connection is given, the services
     * that run over it.
     *
     * @param broker     the broker carrying change notifications; closed with
     *                   these services
     * @param connection the live connection, may be null; closed with these
     *                   services
     */
    public RealtimeServices(ScopeBroker broker, ConnectionManager connection) {
        this(broker, connection, OpenTelemetry.noop());
    }

    /**
     * @param ot propagates the publishing span into published events
     */
    public RealtimeServices(ScopeBroker broker, ConnectionManager connection, OpenTelemetry ot) {
        closeables.add(broker);
        this.registry = new ChannelRegistry(broker);
        closeables.add(registry);
        this.presence = new PresenceTracker();
        this.events = new RealtimeEvents(registry, ot);
        this.connection = connection;
        if (connection != null) {
            closeables.add(connection);
            this.notifications = new NotificationService(connection);
            this.chat = new ChatService(connection);
            this.collaboration = new CollaborationService(connection, presence);
            closeables.add(notifications);
            closeables.add(chat);
            closeables.add(collaboration);
        } else {
            this.notifications = null;
            this.chat = null;
            this.collaboration = null;
        }
    }

    public ChannelRegistry registry() {
        return registry;
    }

    public PresenceTracker presence() {
        return presence;
    }

    public RealtimeEvents events() {
        return events;
    }

    public ConnectionManager connection() {
        return requireConnection(connection);
    }

    public NotificationService notifications() {
        return requireConnection(notifications);
    }

    public ChatService chat() {
        return requireConnection(chat);
    }

    public CollaborationService collaboration() {
        return requireConnection(collaboration);
    }

    private static <T> T requireConnection(T service) {
        if (service == null) {
            throw new IllegalStateException("No connection was configured");
        }
        return service;
    }

    @Override
    public void close() {
        logger.atInfo().log("Closing realtime services");

        List<AutoCloseable> reversed = new ArrayList<>(closeables);
        Collections.reverse(reversed);
        for (AutoCloseable c : reversed) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }

        logger.atInfo().log("Realtime services closed");
    }
}
