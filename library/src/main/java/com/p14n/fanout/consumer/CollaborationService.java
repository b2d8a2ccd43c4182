package com.p14n.fanout.consumer;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.connection.MessageHandler;
import com.p14n.fanout.connection.RealtimeMessaging;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.presence.PresenceFeed;
import com.p14n.fanout.presence.PresenceListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps room presence in step with {@code presence} messages and passes
 * {@code collaboration} messages on to listeners.
 *
 * <p>
 * A presence message carries {@code {"action": "join"|"leave"}}; the
 * participant is the message sender.
 * </p>
 */
public class CollaborationService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CollaborationService.class);

    static final String ACTION = "action";
    static final String USER_ID = "userId";
    static final String JOIN = "join";
    static final String LEAVE = "leave";
    static final String UNKNOWN_SENDER = "unknown";

    private final RealtimeMessaging messaging;
    private final PresenceFeed presence;
    private final Set<MessageHandler> collaborationListeners = new CopyOnWriteArraySet<>();
    private final List<Subscription> subscriptions;

    public CollaborationService(RealtimeMessaging messaging, PresenceFeed presence) {
        this.messaging = messaging;
        this.presence = presence;
        this.subscriptions = List.of(
                messaging.subscribeToType(MessageType.PRESENCE, this::onPresenceMessage),
                messaging.subscribeToType(MessageType.COLLABORATION, this::onCollaborationMessage));
    }

    private void onPresenceMessage(WireMessage message) {
        String room = message.room() == null || message.room().isEmpty() ? ChatService.DEFAULT_ROOM
                : message.room();
        String userId = message.sender() == null || message.sender().isEmpty() ? UNKNOWN_SENDER
                : message.sender();
        String action = message.data().path(ACTION).asText();

        if (JOIN.equals(action)) {
            presence.join(room, userId);
        } else if (LEAVE.equals(action)) {
            presence.leave(room, userId);
        } else {
            logger.atDebug()
                    .addArgument(action)
                    .addArgument(room)
                    .log("Ignoring presence action '{}' in {}");
        }
    }

    private void onCollaborationMessage(WireMessage message) {
        for (MessageHandler listener : collaborationListeners) {
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(message.id())
                        .setCause(e)
                        .log("Collaboration listener failed on {}");
            }
        }
    }

    public WireMessage joinCollaboration(String room, String userId) {
        return messaging.send(presenceMessage(JOIN, room, userId));
    }

    public WireMessage leaveCollaboration(String room, String userId) {
        return messaging.send(presenceMessage(LEAVE, room, userId));
    }

    private static OutboundMessage presenceMessage(String action, String room, String userId) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put(ACTION, action);
        data.put(USER_ID, userId);
        return new OutboundMessage(MessageType.PRESENCE, data, userId, room);
    }

    public Subscription onPresenceChange(String room, PresenceListener listener) {
        return presence.onPresenceChange(room, listener);
    }

    public Subscription onCollaboration(MessageHandler listener) {
        collaborationListeners.add(listener);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                collaborationListeners.remove(listener);
            }

            @Override
            public boolean isActive() {
                return collaborationListeners.contains(listener);
            }
        };
    }

    public List<String> getCollaborators(String room) {
        return presence.participants(room);
    }

    @Override
    public void close() {
        subscriptions.forEach(Subscription::unsubscribe);
        collaborationListeners.clear();
    }
}
