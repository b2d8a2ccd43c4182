package com.p14n.fanout.db;

import com.p14n.fanout.data.FanoutConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseSetup(FanoutConfig cfg) {
        this(cfg.jdbcUrl(), cfg.dbUser(), cfg.dbPassword());
    }

    public DatabaseSetup(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createEventsTableIfNotExists();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS fanout");
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createEventsTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = """
                    CREATE TABLE IF NOT EXISTS fanout.realtime_events (
                        idn bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        id VARCHAR(255) NOT NULL UNIQUE,
                        event_type VARCHAR(255) NOT NULL,
                        user_id VARCHAR(255),
                        organization_id VARCHAR(255),
                        room VARCHAR(255),
                        payload jsonb NOT NULL,
                        created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT current_timestamp,
                        traceparent VARCHAR(255)
                    )""";

            stmt.execute(sql);
            logger.atInfo().log("Realtime events table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating realtime events table");
            throw new RuntimeException("Failed to create realtime_events table", e);
        }
        return this;
    }

    private Connection getConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

    public static DataSource createPool(FanoutConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        return ds;
    }
}
