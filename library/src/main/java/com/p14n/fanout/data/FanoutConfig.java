package com.p14n.fanout.data;

import java.util.Properties;

/**
 * Configuration interface for the durable change feed. Defines the database
 * coordinates and the settings of the change capture engine.
 */
public interface FanoutConfig {
    /**
     * Gets the affinity identifier for this instance. The affinity names the
     * replication slot so that several instances can follow the same database.
     *
     * @return The affinity string identifier
     */
    String affinity();

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Gets additional change capture properties that replace the defaults.
     *
     * @return Properties object containing override values, or null
     */
    Properties overrideProps();

    /**
     * Gets the poll interval of the change capture engine.
     *
     * @return The poll interval in milliseconds
     */
    int pollInterval();

    /**
     * Gets the startup timeout in seconds.
     * Default is 30 seconds.
     *
     * @return The startup timeout in seconds
     */
    default int startupTimeoutSeconds() {
        return 30;
    }

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
