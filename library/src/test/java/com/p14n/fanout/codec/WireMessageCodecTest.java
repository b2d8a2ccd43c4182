package com.p14n.fanout.codec;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.exception.MalformedMessageException;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WireMessageCodecTest {

    @Test
    void decodesAFullMessage() {
        WireMessage message = WireMessageCodec.decode("""
                {"id":"m1","type":"chat","data":{"content":"hi"},"timestamp":"2024-10-27T22:11:07Z",
                 "sender":"ann","room":"board"}""");

        assertEquals("m1", message.id());
        assertEquals(MessageType.CHAT, message.type());
        assertEquals("hi", message.data().get("content").asText());
        assertEquals(Instant.parse("2024-10-27T22:11:07Z"), message.timestamp());
        assertEquals("ann", message.sender());
        assertEquals("board", message.room());
    }

    @Test
    void onlyTypeIsRequired() {
        WireMessage message = WireMessageCodec.decode("{\"type\":\"presence\"}");

        assertEquals(MessageType.PRESENCE, message.type());
        assertTrue(message.data().isObject());
        assertNull(message.id());
        assertNull(message.room());
    }

    @Test
    void encodingLeavesOutAbsentSenderAndRoom() {
        String json = WireMessageCodec.encode(new WireMessage("m1", MessageType.UPDATE,
                JsonNodeFactory.instance.objectNode(), Instant.EPOCH, null, null));

        assertFalse(json.contains("sender"));
        assertFalse(json.contains("room"));
        assertTrue(json.contains("\"type\":\"update\""));
    }

    @Test
    void rejectsMalformedFrames() {
        assertThrows(MalformedMessageException.class, () -> WireMessageCodec.decode("not json"));
        assertThrows(MalformedMessageException.class, () -> WireMessageCodec.decode("\"chat\""));
        assertThrows(MalformedMessageException.class, () -> WireMessageCodec.decode("{\"data\":{}}"));
        assertThrows(MalformedMessageException.class, () -> WireMessageCodec.decode("{\"type\":\"shout\"}"));
        assertThrows(MalformedMessageException.class,
                () -> WireMessageCodec.decode("{\"type\":\"chat\",\"timestamp\":\"soon\"}"));
    }
}
