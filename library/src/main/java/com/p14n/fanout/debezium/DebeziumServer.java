package com.p14n.fanout.debezium;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.fanout.data.FanoutConfig;

import io.debezium.engine.ChangeEvent;
import io.debezium.engine.DebeziumEngine;
import io.debezium.engine.format.Json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an embedded Debezium engine that captures inserts into
 * {@code fanout.realtime_events} through the pgoutput plugin.
 *
 * <p>
 * Offsets live in memory only. A restarted instance creates a fresh
 * replication slot and sees events written from then on; the slot is dropped
 * when the engine stops.
 * </p>
 *
 * <pre>{@code
 * DebeziumServer server = new DebeziumServer();
 * server.start(config, event -> handle(event));
 * ...
 * server.stop();
 * }</pre>
 */
public class DebeziumServer {
        private static final Logger logger = LoggerFactory.getLogger(DebeziumServer.class);

        /**
         * Creates Debezium configuration properties for the events table.
         *
         * @param affinity     Identifier for this instance, names the replication slot
         * @param dbHost       Database host address
         * @param dbPort       Database port
         * @param dbUser       Database username
         * @param dbPassword   Database password
         * @param dbName       Database name
         * @param pollInterval Interval in milliseconds between polls
         * @return Properties configured for the Debezium PostgreSQL connector
         */
        public static Properties props(
                        String affinity,
                        String dbHost,
                        String dbPort,
                        String dbUser,
                        String dbPassword,
                        String dbName,
                        int pollInterval) {
                final Properties props = new Properties();

                props.setProperty("name", "fanout-" + affinity);
                props.setProperty("connector.class", "io.debezium.connector.postgresql.PostgresConnector");
                props.setProperty("offset.storage", "org.apache.kafka.connect.storage.MemoryOffsetBackingStore");
                props.setProperty("offset.flush.interval.ms", "1000");
                props.setProperty("poll.interval.ms", String.valueOf(pollInterval));
                props.setProperty("database.hostname", dbHost);
                props.setProperty("plugin.name", "pgoutput");
                props.setProperty("database.port", dbPort);
                props.setProperty("database.user", dbUser);
                props.setProperty("database.password", dbPassword);
                props.setProperty("database.dbname", dbName);
                props.setProperty("table.include.list", "fanout." + Functions.EVENTS_TABLE);
                props.setProperty("topic.prefix", "fanout");
                props.setProperty("publication.name", "fanout_" + affinity);
                props.setProperty("publication.autocreate.mode", "filtered");
                props.setProperty("snapshot.mode", "no_data");
                props.setProperty("slot.name", "fanout_" + affinity);
                props.setProperty("slot.drop.on.stop", "true");
                return props;
        }

        private ExecutorService executor;
        private DebeziumEngine<ChangeEvent<String, String>> engine;

        /**
         * Starts the engine and waits until its task is running.
         *
         * @param cfg      Configuration for the Debezium engine
         * @param consumer Consumer to process change events
         * @throws IllegalStateException if the consumer or config is null, the
         *                               engine stops while starting or the
         *                               startup timeout is exceeded
         * @throws InterruptedException  if startup is interrupted
         */
        public void start(FanoutConfig cfg,
                        Consumer<ChangeEvent<String, String>> consumer) throws InterruptedException {
                if (consumer == null) {
                        throw new IllegalStateException("Change event consumer must be set before starting the engine");
                }
                if (cfg == null) {
                        throw new IllegalStateException("Config must be set before starting the engine");
                }
                logger.atInfo()
                                .addArgument(cfg.affinity())
                                .log("Starting Debezium engine with affinity {}");
                var started = new CountDownLatch(1);
                var failure = new AtomicReference<String>();
                engine = DebeziumEngine.create(Json.class)
                                .using(new DebeziumEngine.ConnectorCallback() {
                                        @Override
                                        public void taskStarted() {
                                                started.countDown();
                                        }
                                })
                                .using((success, message, error) -> {
                                        if (!success) {
                                                logger.atError()
                                                                .addArgument(message)
                                                                .setCause(error)
                                                                .log("Debezium engine stopped: {}");
                                                failure.set(message == null ? "unknown error" : message);
                                        }
                                        started.countDown();
                                })
                                .using(cfg.overrideProps() != null ? cfg.overrideProps()
                                                : props(cfg.affinity(), cfg.dbHost(),
                                                                String.valueOf(cfg.dbPort()), cfg.dbUser(),
                                                                cfg.dbPassword(),
                                                                cfg.dbName(), cfg.pollInterval()))
                                .notifying(consumer)
                                .build();
                executor = Executors.newSingleThreadExecutor(
                                new ThreadFactoryBuilder().setNameFormat("fanout-debezium-%d").build());
                executor.execute(engine);
                if (!started.await(cfg.startupTimeoutSeconds(), TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Debezium engine failed to start within "
                                        + cfg.startupTimeoutSeconds() + " seconds");
                }
                if (failure.get() != null) {
                        throw new IllegalStateException("Debezium engine failed to start: " + failure.get());
                }
                logger.atInfo().log("Debezium engine started successfully");
        }

        /**
         * Stops the engine and its executor, waiting up to five seconds.
         *
         * @throws IOException if engine shutdown fails
         */
        public void stop() throws IOException {
                if (executor != null) {
                        executor.shutdown();
                }
                if (engine != null) {
                        engine.close();
                }
                if (executor != null) {
                        executor.shutdownNow();
                        try {
                                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                                        logger.atWarn().log("Debezium executor did not terminate within 5 seconds");
                                }
                        } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                logger.atError().setCause(e).log("Interrupted while stopping Debezium");
                        }
                }
        }
}
