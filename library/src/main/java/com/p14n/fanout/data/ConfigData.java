package com.p14n.fanout.data;

import java.util.Properties;

public record ConfigData(String affinity,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        int pollInterval,
        Properties overrideProps) implements FanoutConfig {

    public ConfigData(String affinity,
                      String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName,
                      int pollInterval) {
        this(affinity, dbHost, dbPort, dbUser, dbPassword, dbName, pollInterval, null);
    }

    public ConfigData(String affinity,
                      String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(affinity, dbHost, dbPort, dbUser, dbPassword, dbName, 500, null);
    }
}
