package com.p14n.fanout.db;

import com.p14n.fanout.data.Event;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;

public class SQL {

    public static final String TABLE = "fanout.realtime_events";
    public static final String CORE_COLS = "id, event_type, user_id, organization_id, room, payload, created_at, traceparent";
    public static final String CORE_PH = "?,?,?,?,?,?::jsonb,?,?";

    private SQL() {
    }

    public static void setEventOnStatement(PreparedStatement stmt, Event event) throws SQLException {
        stmt.setString(1, event.id());
        stmt.setString(2, event.kind());
        stmt.setString(3, event.scopeAttributes().userId());
        stmt.setString(4, event.scopeAttributes().organizationId());
        stmt.setString(5, event.scopeAttributes().room());
        stmt.setString(6, event.payload().toString());
        stmt.setTimestamp(7, Timestamp.from(event.createdAt()));
        stmt.setString(8, event.traceparent());
    }

}
