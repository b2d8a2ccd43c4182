package com.p14n.fanout.data;

import java.util.List;

/**
 * A raw change notification: one stored event record as emitted by the backing
 * store, plus the scope keys it must be routed to.
 *
 * @param id          id of the stored event
 * @param kind        event kind, taken from the {@code event_type} column
 * @param scopeKeys   scope keys the record matches
 * @param json        the record in its durable JSON form
 * @param traceparent trace context stored with the record, may be null
 */
public record ChangeRecord(String id,
        String kind,
        List<String> scopeKeys,
        String json,
        String traceparent) implements Traceable {

    public ChangeRecord {
        scopeKeys = scopeKeys == null ? List.of() : List.copyOf(scopeKeys);
    }

    @Override
    public String subject() {
        return kind;
    }
}
