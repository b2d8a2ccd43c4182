package com.p14n.fanout;

import java.io.IOException;
import java.util.function.Consumer;

import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.data.FanoutConfig;
import com.p14n.fanout.db.DatabaseSetup;
import com.p14n.fanout.debezium.DebeziumServer;
import com.p14n.fanout.debezium.Functions;
import com.p14n.fanout.exception.MalformedMessageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows the events table and passes every inserted row to a sink as a
 * {@link ChangeRecord}. Rows that cannot be read are logged and skipped.
 */
public class ChangeFeed implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChangeFeed.class);

    private final DebeziumServer debezium;
    private final Consumer<ChangeRecord> sink;
    private final DatabaseSetup db;
    private final FanoutConfig cfg;

    public ChangeFeed(FanoutConfig cfg, Consumer<ChangeRecord> sink) {
        this.cfg = cfg;
        this.sink = sink;
        this.db = new DatabaseSetup(cfg);
        this.debezium = new DebeziumServer();
    }

    public void start() throws InterruptedException {
        logger.atInfo().log("Starting change feed");

        try {
            db.setupAll();
            debezium.start(cfg, record -> handle(record.value()));
            logger.atInfo().log("Change feed started successfully");
        } catch (RuntimeException | InterruptedException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start change feed");
            throw e;
        }
    }

    /**
     * Passes one captured change to the sink. Nothing thrown here reaches the
     * engine: a failure would stop it and end the feed.
     *
     * @param value the change event value
     */
    void handle(String value) {
        ChangeRecord change;
        try {
            change = Functions.changeValueToRecord(value);
        } catch (MalformedMessageException e) {
            logger.atWarn()
                    .setCause(e)
                    .log("Dropping unreadable change event");
            return;
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Dropping change event that could not be converted");
            return;
        }
        if (change == null) {
            return;
        }
        try {
            sink.accept(change);
        } catch (RuntimeException e) {
            logger.atError()
                    .addArgument(change.id())
                    .setCause(e)
                    .log("Failed to route change {}");
        }
    }

    public void stop() {
        logger.atInfo().log("Stopping change feed");
        try {
            debezium.stop();
            logger.atInfo().log("Change feed stopped successfully");
        } catch (IOException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to stop change feed");
            throw new RuntimeException("Failed to stop change feed", e);
        }
    }

    @Override
    public void close() {
        stop();
    }
}
