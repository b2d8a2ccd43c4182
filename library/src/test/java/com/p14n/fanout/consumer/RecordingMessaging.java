package com.p14n.fanout.consumer;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.connection.MessageHandler;
import com.p14n.fanout.connection.RealtimeMessaging;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;

/**
 * In-memory messaging that records what is sent and lets tests play inbound
 * messages.
 */
class RecordingMessaging implements RealtimeMessaging {

    final List<WireMessage> sent = new CopyOnWriteArrayList<>();
    final Map<MessageType, Set<MessageHandler>> handlers = new ConcurrentHashMap<>();
    private int ids;

    @Override
    public Subscription subscribeToType(MessageType type, MessageHandler handler) {
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArraySet<>()).add(handler);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                handlers.get(type).remove(handler);
            }

            @Override
            public boolean isActive() {
                return handlers.get(type).contains(handler);
            }
        };
    }

    @Override
    public synchronized WireMessage send(OutboundMessage message) {
        WireMessage wire = WireMessage.stamp(message, "out-" + (++ids), Instant.EPOCH);
        sent.add(wire);
        return wire;
    }

    @Override
    public WireMessage joinRoom(String room) {
        return send(OutboundMessage.of(MessageType.UPDATE,
                JsonNodeFactory.instance.objectNode().put("action", "join_room").put("room", room)));
    }

    @Override
    public WireMessage leaveRoom(String room) {
        return send(OutboundMessage.of(MessageType.UPDATE,
                JsonNodeFactory.instance.objectNode().put("action", "leave_room").put("room", room)));
    }

    void receive(String id, MessageType type, JsonNode data, String sender, String room) {
        WireMessage message = new WireMessage(id, type,
                data == null ? JsonNodeFactory.instance.objectNode() : data, Instant.EPOCH, sender, room);
        handlers.getOrDefault(type, Set.of()).forEach(h -> h.onMessage(message));
    }
}
