package com.p14n.fanout.debezium;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.fanout.codec.EventRecordCodec;
import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.exception.MalformedMessageException;

import io.debezium.engine.ChangeEvent;

/**
 * Turns Debezium change events for {@code fanout.realtime_events} into
 * {@link ChangeRecord}s. Only inserts are of interest: stored events never
 * change.
 */
public class Functions {

    static final String EVENTS_TABLE = "realtime_events";

    private static final ObjectMapper mapper = new ObjectMapper();

    private Functions() {
    }

    /**
     * Converts a change event.
     *
     * @param record the Debezium change event in JSON format
     * @return the change record, or null when the event is not an insert into the
     *         events table
     * @throws MalformedMessageException if the event cannot be parsed or the
     *                                   inserted row is incomplete
     */
    public static ChangeRecord changeEventToRecord(ChangeEvent<String, String> record) {
        return changeValueToRecord(record.value());
    }

    /**
     * Converts the JSON value of a change event.
     *
     * @param value the change event value, may be null for tombstones
     * @return the change record, or null when the event is not an insert into the
     *         events table
     */
    public static ChangeRecord changeValueToRecord(String value) {
        if (value == null) {
            return null;
        }
        JsonNode actualObj;
        try {
            actualObj = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Change event is not valid JSON", e);
        }
        var payload = actualObj.get("payload");
        if (payload == null || !"c".equals(text(payload.get("op")))) {
            return null;
        }
        var source = payload.get("source");
        if (source == null || !EVENTS_TABLE.equals(text(source.get("table")))) {
            return null;
        }
        return EventRecordCodec.toChangeRecord(payload.get("after"));
    }

    private static String text(JsonNode j) {
        if (j != null && !j.isNull()) {
            return j.asText();
        }
        return null;
    }
}
