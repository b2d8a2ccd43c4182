package com.p14n.fanout.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.ScopeAttributes;
import com.p14n.fanout.exception.MalformedMessageException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Converts events to and from their durable record form:
 *
 * <pre>{@code
 * {
 *   "id": "...", "event_type": "dashboard_update",
 *   "user_id": "7", "organization_id": "42", "room": null,
 *   "payload": { ... }, "created_at": "2024-10-27T22:11:07.937038Z",
 *   "traceparent": null
 * }
 * }</pre>
 *
 * <p>
 * Rows captured from the database carry {@code payload} as a JSON string
 * (the {@code jsonb} column is emitted as text), which is accepted too.
 * </p>
 */
public class EventRecordCodec {

    public static final String ID = "id";
    public static final String EVENT_TYPE = "event_type";
    public static final String USER_ID = "user_id";
    public static final String ORGANIZATION_ID = "organization_id";
    public static final String ROOM = "room";
    public static final String PAYLOAD = "payload";
    public static final String CREATED_AT = "created_at";
    public static final String TRACEPARENT = "traceparent";

    private static final ObjectMapper mapper = new ObjectMapper();

    private EventRecordCodec() {
    }

    public static ObjectNode toRecord(Event event) {
        ObjectNode record = mapper.createObjectNode();
        record.put(ID, event.id());
        record.put(EVENT_TYPE, event.kind());
        record.put(USER_ID, event.scopeAttributes().userId());
        record.put(ORGANIZATION_ID, event.scopeAttributes().organizationId());
        record.put(ROOM, event.scopeAttributes().room());
        record.set(PAYLOAD, event.payload());
        record.put(CREATED_AT, event.createdAt().toString());
        record.put(TRACEPARENT, event.traceparent());
        return record;
    }

    public static String encode(Event event) {
        return toRecord(event).toString();
    }

    /**
     * Builds the change notification for a freshly published event.
     */
    public static ChangeRecord toChangeRecord(Event event) {
        return new ChangeRecord(event.id(), event.kind(), event.scopeKeys(), encode(event), event.traceparent());
    }

    /**
     * Builds the change notification for a stored row.
     *
     * @param row the row as a JSON object
     * @return the change record
     * @throws MalformedMessageException if the row lacks an id or event type, or
     *                                   its scope attributes are invalid
     */
    public static ChangeRecord toChangeRecord(JsonNode row) {
        if (row == null || !row.isObject()) {
            throw new MalformedMessageException("Change record is not a JSON object");
        }
        String id = requiredText(row, ID);
        String kind = requiredText(row, EVENT_TYPE);
        try {
            var scope = new ScopeAttributes(text(row, USER_ID), text(row, ORGANIZATION_ID), text(row, ROOM));
            return new ChangeRecord(id, kind, scope.scopeKeys(), row.toString(), text(row, TRACEPARENT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Change record is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a durable record into an event.
     *
     * @param json the record
     * @return the event
     * @throws MalformedMessageException if the record cannot be decoded
     */
    public static Event decode(String json) {
        if (json == null) {
            throw new MalformedMessageException("Change record is empty");
        }
        JsonNode row;
        try {
            row = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Change record is not valid JSON", e);
        }
        if (row == null || !row.isObject()) {
            throw new MalformedMessageException("Change record is not a JSON object");
        }
        try {
            return new Event(
                    requiredText(row, ID),
                    requiredText(row, EVENT_TYPE),
                    new ScopeAttributes(text(row, USER_ID), text(row, ORGANIZATION_ID), text(row, ROOM)),
                    payload(row.get(PAYLOAD)),
                    createdAt(row.get(CREATED_AT)),
                    text(row, TRACEPARENT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Change record is invalid: " + e.getMessage(), e);
        }
    }

    private static JsonNode payload(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            try {
                return mapper.readTree(node.asText());
            } catch (JsonProcessingException e) {
                throw new MalformedMessageException("Record payload is not valid JSON", e);
            }
        }
        return node;
    }

    private static Instant createdAt(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new MalformedMessageException("Record created_at is not an ISO-8601 instant", e);
        }
    }

    private static String requiredText(JsonNode row, String field) {
        String value = text(row, field);
        if (value == null || value.isEmpty()) {
            throw new MalformedMessageException("Change record is missing " + field);
        }
        return value;
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
