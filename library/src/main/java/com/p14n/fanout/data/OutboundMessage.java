package com.p14n.fanout.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A message as supplied by a caller, before the connection assigns its id and
 * timestamp.
 *
 * @param type   the message type
 * @param data   the message body
 * @param sender optional sender id
 * @param room   optional room name
 */
public record OutboundMessage(MessageType type, JsonNode data, String sender, String room) {

    public OutboundMessage {
        if (type == null) {
            throw new IllegalArgumentException("Message type cannot be null");
        }
        if (data == null) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static OutboundMessage of(MessageType type, JsonNode data) {
        return new OutboundMessage(type, data, null, null);
    }

    public static OutboundMessage toRoom(MessageType type, JsonNode data, String room) {
        return new OutboundMessage(type, data, null, room);
    }
}
