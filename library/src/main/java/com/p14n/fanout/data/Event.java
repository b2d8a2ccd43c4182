package com.p14n.fanout.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Record representing an event to be published to its scoped audiences. The
 * payload is copied on construction so an event cannot change after it is
 * published.
 *
 * @param id              unique identifier, used as the storage key
 * @param kind            the event kind, e.g. {@code dashboard_update}
 * @param scopeAttributes the audiences the event is addressed to
 * @param payload         opaque JSON payload
 * @param createdAt       creation time
 * @param traceparent     W3C trace context of the producer, may be null
 */
public record Event(String id,
        String kind,
        ScopeAttributes scopeAttributes,
        JsonNode payload,
        Instant createdAt,
        String traceparent) implements Traceable {

    public Event {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("kind cannot be null or empty");
        }
        if (scopeAttributes == null) {
            scopeAttributes = new ScopeAttributes(null, null, null);
        }
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a new untraced event with a random id and the current time.
     */
    public static Event create(String kind, ScopeAttributes scopeAttributes, JsonNode payload) {
        return create(kind, scopeAttributes, payload, null);
    }

    /**
     * Creates a new event with a random id and the current time.
     */
    public static Event create(String kind, ScopeAttributes scopeAttributes, JsonNode payload, String traceparent) {
        return new Event(UUID.randomUUID().toString(), kind, scopeAttributes, payload, Instant.now(), traceparent);
    }

    /**
     * Returns the scope keys this event is delivered to, ordered user, org, room.
     *
     * @return the matching scope keys
     */
    public List<String> scopeKeys() {
        return scopeAttributes.scopeKeys();
    }

    @Override
    public String subject() {
        return kind;
    }
}
