package com.p14n.fanout;

import com.p14n.fanout.data.Event;
import com.p14n.fanout.db.SQL;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import static com.p14n.fanout.db.SQL.setEventOnStatement;

/**
 * Writes events to the {@code fanout.realtime_events} table. Nothing is fanned
 * out here: subscribers hear about the row through the change feed once the
 * surrounding transaction commits.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * // Inside an existing transaction
 * Connection conn = ...;
 * Publisher.publish(event, conn);
 *
 * // Using a DataSource
 * DataSource ds = ...;
 * Publisher.publish(event, ds);
 * }</pre>
 */
public class Publisher {

    private Publisher() {
    }

    /**
     * Inserts an event using the caller's connection.
     *
     * @param event      The event to publish
     * @param connection The database connection
     * @throws SQLException if a database access error occurs, including a
     *                      duplicate event id
     */
    public static void publish(Event event, Connection connection) throws SQLException {
        String sql = String.format("INSERT INTO %s (%s) VALUES (%s)", SQL.TABLE, SQL.CORE_COLS, SQL.CORE_PH);

        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setEventOnStatement(stmt, event);
            stmt.executeUpdate();
        }
    }

    /**
     * Inserts an event on a connection borrowed from the DataSource.
     *
     * @param event The event to publish
     * @param ds    The DataSource to obtain a connection from
     * @throws SQLException if a database access error occurs
     */
    public static void publish(Event event, DataSource ds) throws SQLException {
        try (Connection c = ds.getConnection()) {
            publish(event, c);
        }
    }
}
