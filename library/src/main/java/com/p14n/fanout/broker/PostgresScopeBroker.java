package com.p14n.fanout.broker;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import javax.sql.DataSource;

import com.p14n.fanout.ChangeFeed;
import com.p14n.fanout.Publisher;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.FanoutConfig;
import com.p14n.fanout.exception.PublishFailureException;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.fanout.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Durable backing. {@link #publish(Event)} inserts the event into
 * {@code fanout.realtime_events} on a worker thread; routing happens when the
 * {@link ChangeFeed} reports the committed row.
 */
public class PostgresScopeBroker extends ScopeRoutingBroker {

    private static final Logger logger = LoggerFactory.getLogger(PostgresScopeBroker.class);

    private final DataSource ds;
    private final AsyncExecutor asyncExecutor;
    private final ChangeFeed changeFeed;

    public PostgresScopeBroker(DataSource ds, FanoutConfig cfg, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        super(ot, "postgres_scope_broker");
        this.ds = ds;
        this.asyncExecutor = asyncExecutor;
        this.changeFeed = new ChangeFeed(cfg, this::route);
    }

    public PostgresScopeBroker(DataSource ds, FanoutConfig cfg, OpenTelemetry ot) {
        this(ds, cfg, new DefaultExecutor(1, 4), ot);
    }

    /**
     * Creates the schema if needed and starts following the events table.
     *
     * @throws InterruptedException if interrupted while the change feed starts
     */
    public void start() throws InterruptedException {
        changeFeed.start();
    }

    @Override
    public CompletableFuture<Void> publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            asyncExecutor.submit(() -> {
                processWithTelemetry(openTelemetry, router.tracer, event, null, "publish_event", () -> {
                    write(event, result);
                    return null;
                });
                return null;
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new PublishFailureException(event.id(), e));
        }
        return result;
    }

    private void write(Event event, CompletableFuture<Void> result) {
        try {
            Publisher.publish(event, ds);
            logger.atDebug().addArgument(event.id()).log("Stored event {}");
            result.complete(null);
        } catch (SQLException | RuntimeException e) {
            logger.atWarn()
                    .addArgument(event.id())
                    .setCause(e)
                    .log("Failed to store event {}");
            result.completeExceptionally(new PublishFailureException(event.id(), e));
        }
    }

    @Override
    public void close() {
        try {
            changeFeed.close();
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Error closing change feed");
        }
        asyncExecutor.close();
        super.close();
    }
}
