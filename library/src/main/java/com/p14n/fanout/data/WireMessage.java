package com.p14n.fanout.data;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A message as it travels over a real-time connection. {@code id} and
 * {@code timestamp} are always assigned by the sending connection.
 *
 * @param id        unique message id
 * @param type      the message type
 * @param data      the message body
 * @param timestamp send time
 * @param sender    optional sender id
 * @param room      optional room name
 */
public record WireMessage(String id,
        MessageType type,
        JsonNode data,
        Instant timestamp,
        String sender,
        String room) implements Traceable {

    /**
     * Stamps an outbound message.
     */
    public static WireMessage stamp(OutboundMessage message, String id, Instant timestamp) {
        return new WireMessage(id, message.type(), message.data(), timestamp, message.sender(), message.room());
    }

    @Override
    public String subject() {
        return type.wireName();
    }

    @Override
    public String traceparent() {
        return null;
    }
}
