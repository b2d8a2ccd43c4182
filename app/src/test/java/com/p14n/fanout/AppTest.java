package com.p14n.fanout;

import com.p14n.fanout.data.ConfigData;
import com.p14n.fanout.data.ConnectionConfig;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void storeConfigFallsBackToLocalDefaults() {
        ConfigData cfg = App.storeConfig(Map.of("APP_DB_HOST", "db.internal"), "a1b2c3d4");

        assertEquals("a1b2c3d4", cfg.affinity());
        assertEquals("db.internal", cfg.dbHost());
        assertEquals(5432, cfg.dbPort());
        assertEquals("postgres", cfg.dbName());
        assertEquals("jdbc:postgresql://db.internal:5432/postgres", cfg.jdbcUrl());
    }

    @Test
    void connectionIsOptional() {
        assertNull(App.connectionConfig(Map.of()));
        assertNull(App.connectionConfig(Map.of("APP_WS_URL", " ")));

        ConnectionConfig cc = App.connectionConfig(Map.of(
                "APP_WS_URL", "ws://localhost:8080/ws",
                "APP_WS_TOKEN", "abc"));
        assertEquals("ws://localhost:8080/ws?token=abc", cc.endpoint().toString());
        assertEquals(ConnectionConfig.DEFAULT_MAX_RECONNECT_ATTEMPTS, cc.maxReconnectAttempts());
    }

    @Test
    void listValuesAreCommaSeparated() {
        assertArrayEquals(new String[] { "42", "7" }, App.envVals(Map.of("APP_WATCH_ORGS", "42,7"), "APP_WATCH_ORGS"));
        assertEquals(0, App.envVals(Map.of(), "APP_WATCH_ORGS").length);
    }
}
