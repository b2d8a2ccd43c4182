package com.p14n.fanout.broker;

import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.data.ChangeRecord;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routing shared by every {@link ScopeBroker} backing. Subclasses decide how a
 * published event is carried and call {@link #route(ChangeRecord)} once the
 * change notification comes back.
 */
public abstract class ScopeRoutingBroker implements ScopeBroker {

    private static final Logger logger = LoggerFactory.getLogger(ScopeRoutingBroker.class);

    protected final ChangeRecordBroker router;
    protected final OpenTelemetry openTelemetry;

    protected ScopeRoutingBroker(OpenTelemetry ot, String scopeName) {
        this.openTelemetry = ot;
        this.router = new ChangeRecordBroker(ot, scopeName);
    }

    /**
     * Hands a change record to the subscribers of every scope key it matches,
     * one scope after the other in the record's key order.
     *
     * @param record the change record
     */
    protected void route(ChangeRecord record) {
        logger.atDebug()
                .addArgument(record.id())
                .addArgument(record.scopeKeys())
                .log("Routing {} to {}");
        for (String scopeKey : record.scopeKeys()) {
            deliver(scopeKey, record);
        }
    }

    /**
     * Hands a change record to the subscribers of a single scope key. Records
     * arriving after {@link #close()} are dropped.
     *
     * @param scopeKey the scope key
     * @param record   the change record
     */
    protected void deliver(String scopeKey, ChangeRecord record) {
        if (isClosed()) {
            logger.atDebug().addArgument(record.id()).log("Broker closed, dropping {}");
            return;
        }
        try {
            router.publish(scopeKey, record);
        } catch (IllegalStateException e) {
            if (!isClosed()) {
                throw e;
            }
            // closed between the check and the publish
            logger.atDebug().addArgument(record.id()).log("Broker closed, dropping {}");
        }
    }

    protected boolean isClosed() {
        return router.closed.get();
    }

    @Override
    public Subscription subscribe(String scopeKey, MessageSubscriber<String> subscriber) {
        router.subscribe(scopeKey, subscriber);
        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                if (active.compareAndSet(true, false)) {
                    router.unsubscribe(scopeKey, subscriber);
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    /**
     * Returns whether any subscriber listens on a scope key.
     *
     * @param scopeKey the scope key
     * @return true when subscribed
     */
    public boolean hasSubscribers(String scopeKey) {
        return router.hasSubscribers(scopeKey);
    }

    @Override
    public void close() {
        router.close();
    }
}
