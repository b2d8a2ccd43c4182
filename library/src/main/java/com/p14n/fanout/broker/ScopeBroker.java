package com.p14n.fanout.broker;

import java.util.concurrent.CompletableFuture;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.data.Event;

/**
 * Publish/subscribe seam between the channel registry and whatever carries
 * change notifications. Topics are scope keys; subscribers receive each
 * matching change record as its durable JSON form.
 */
public interface ScopeBroker extends AutoCloseable {

    /**
     * Records an event. Completion means the backing accepted the write, not
     * that any subscriber has seen it.
     *
     * @param event the event to publish
     * @return a future failed with
     *         {@link com.p14n.fanout.exception.PublishFailureException} when the
     *         write is rejected
     */
    CompletableFuture<Void> publish(Event event);

    /**
     * Subscribes to change records for one scope key.
     *
     * @param scopeKey   the scope key, see {@link com.p14n.fanout.data.ScopeKeys}
     * @param subscriber receives the raw record JSON
     * @return handle cancelling the subscription
     */
    Subscription subscribe(String scopeKey, MessageSubscriber<String> subscriber);

    @Override
    void close();
}
