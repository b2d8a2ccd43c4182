package com.p14n.fanout.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.ScopeAttributes;
import com.p14n.fanout.exception.MalformedMessageException;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decodesCapturedRowWithTextPayload() throws Exception {
        String row = """
                {"idn":3,"id":"e-1","event_type":"dashboard_update","user_id":null,
                 "organization_id":"42","room":null,"payload":"{\\"overallScore\\":81}",
                 "created_at":"2024-10-27T22:11:07.937038Z","traceparent":null}""";

        Event event = EventRecordCodec.decode(row);

        assertEquals("e-1", event.id());
        assertEquals(81, event.payload().get("overallScore").asInt());
        assertEquals(Instant.parse("2024-10-27T22:11:07.937038Z"), event.createdAt());
        assertEquals(List.of("org:42"), event.scopeKeys());
    }

    @Test
    void encodedRecordKeepsPayloadAsObject() throws Exception {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("overallScore", 81);
        Event event = Event.create("dashboard_update", new ScopeAttributes("7", "42", null), payload);

        var record = mapper.readTree(EventRecordCodec.encode(event));

        assertTrue(record.get("payload").isObject());
        assertEquals("7", record.get("user_id").asText());
        assertTrue(record.get("room").isNull());
        assertEquals(event, EventRecordCodec.decode(record.toString()));
    }

    @Test
    void blankScopeAttributesAreNotScopes() throws Exception {
        var row = mapper.readTree("""
                {"id":"e-3","event_type":"dashboard_update","user_id":" ","organization_id":"42","room":""}""");

        ChangeRecord record = EventRecordCodec.toChangeRecord(row);

        assertEquals(List.of("org:42"), record.scopeKeys());
        assertEquals(List.of("org:42"), new ScopeAttributes(" ", "42", "\t").scopeKeys());
    }

    @Test
    void changeRecordFromRowListsMatchingScopes() throws Exception {
        var row = mapper.readTree("""
                {"id":"e-2","event_type":"team_activity","user_id":"7","organization_id":"42","room":"board"}""");

        ChangeRecord record = EventRecordCodec.toChangeRecord(row);

        assertEquals(List.of("user:7", "org:42", "room:board"), record.scopeKeys());
        assertEquals("team_activity", record.kind());
    }

    @Test
    void rejectsIncompleteRecords() {
        assertThrows(MalformedMessageException.class, () -> EventRecordCodec.decode("[1,2]"));
        assertThrows(MalformedMessageException.class, () -> EventRecordCodec.decode("{\"id\":\"x\"}"));
        assertThrows(MalformedMessageException.class,
                () -> EventRecordCodec.decode("{\"id\":\"x\",\"event_type\":\"k\",\"created_at\":\"yesterday\"}"));
        assertThrows(MalformedMessageException.class, () -> EventRecordCodec.decode(null));
    }

    @Test
    void payloadIsCopiedOnConstruction() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("n", 1);
        Event event = Event.create("k", ScopeAttributes.forUser("7"), payload);

        payload.put("n", 2);

        assertEquals(1, event.payload().get("n").asInt());
    }
}
