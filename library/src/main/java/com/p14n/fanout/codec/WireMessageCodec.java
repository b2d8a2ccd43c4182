package com.p14n.fanout.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.exception.MalformedMessageException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON form of {@link WireMessage}:
 * {@code {id, type, data, timestamp, sender?, room?}}.
 */
public class WireMessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper();

    private WireMessageCodec() {
    }

    public static String encode(WireMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", message.id());
        node.put("type", message.type().wireName());
        node.set("data", message.data());
        node.put("timestamp", message.timestamp() == null ? null : message.timestamp().toString());
        if (message.sender() != null) {
            node.put("sender", message.sender());
        }
        if (message.room() != null) {
            node.put("room", message.room());
        }
        return node.toString();
    }

    /**
     * Decodes an inbound frame. Only {@code type} is required; messages relayed by
     * a server may omit their id or timestamp.
     *
     * @param text the frame
     * @return the message
     * @throws MalformedMessageException if the frame is not a message
     */
    public static WireMessage decode(String text) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Message is not a JSON object");
        }
        String type = text(node, "type");
        if (type == null) {
            throw new MalformedMessageException("Message has no type");
        }
        MessageType messageType;
        try {
            messageType = MessageType.fromWireName(type);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }
        JsonNode data = node.get("data");
        if (data == null || data.isNull()) {
            data = mapper.createObjectNode();
        }
        return new WireMessage(
                text(node, "id"),
                messageType,
                data,
                timestamp(text(node, "timestamp")),
                text(node, "sender"),
                text(node, "room"));
    }

    private static Instant timestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedMessageException("Message timestamp is not an ISO-8601 instant", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
