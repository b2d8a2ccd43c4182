package com.p14n.fanout.consumer;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.connection.RealtimeMessaging;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-room chat history over a real-time connection. Messages without a room
 * belong to {@value #DEFAULT_ROOM}.
 */
public class ChatService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

    public static final String DEFAULT_ROOM = "general";
    static final String CONTENT = "content";
    static final String SENDER = "sender";

    private final RealtimeMessaging messaging;
    private final Map<String, List<WireMessage>> messages = new ConcurrentHashMap<>();
    private final Map<String, Set<ChatListener>> listeners = new ConcurrentHashMap<>();
    private final Subscription subscription;

    public ChatService(RealtimeMessaging messaging) {
        this.messaging = messaging;
        this.subscription = messaging.subscribeToType(MessageType.CHAT, this::onChatMessage);
    }

    private void onChatMessage(WireMessage message) {
        String room = message.room() == null || message.room().isEmpty() ? DEFAULT_ROOM : message.room();
        List<WireMessage> history = messages.computeIfAbsent(room, r -> new CopyOnWriteArrayList<>());
        history.add(message);

        Set<ChatListener> roomListeners = listeners.get(room);
        if (roomListeners == null) {
            return;
        }
        List<WireMessage> snapshot = List.copyOf(history);
        for (ChatListener listener : roomListeners) {
            try {
                listener.onMessages(room, snapshot);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(room)
                        .setCause(e)
                        .log("Chat listener failed in {}");
            }
        }
    }

    public WireMessage sendMessage(String room, String content, String sender) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put(CONTENT, content);
        data.put(SENDER, sender);
        return messaging.send(new OutboundMessage(MessageType.CHAT, data, sender, room));
    }

    public WireMessage joinChatRoom(String room) {
        return messaging.joinRoom(room);
    }

    public WireMessage leaveChatRoom(String room) {
        return messaging.leaveRoom(room);
    }

    public Subscription onMessage(String room, ChatListener listener) {
        listeners.computeIfAbsent(room, r -> new CopyOnWriteArraySet<>()).add(listener);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                listeners.computeIfPresent(room, (r, set) -> {
                    set.remove(listener);
                    return set.isEmpty() ? null : set;
                });
            }

            @Override
            public boolean isActive() {
                Set<ChatListener> set = listeners.get(room);
                return set != null && set.contains(listener);
            }
        };
    }

    public List<WireMessage> getMessages(String room) {
        List<WireMessage> history = messages.get(room);
        return history == null ? List.of() : List.copyOf(history);
    }

    @Override
    public void close() {
        subscription.unsubscribe();
        listeners.clear();
    }
}
