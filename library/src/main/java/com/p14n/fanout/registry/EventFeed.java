package com.p14n.fanout.registry;

import java.util.concurrent.CompletableFuture;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.data.Event;

/**
 * What consumers see of the event distribution layer: subscribe to a scope,
 * publish an event.
 */
public interface EventFeed {

    /**
     * Subscribes a listener to a scope key such as {@code org:42}.
     *
     * @param scopeKey the scope key
     * @param listener the listener
     * @return handle removing the listener; safe to call more than once
     */
    Subscription subscribeToScope(String scopeKey, ScopeListener listener);

    /**
     * Publishes an event to every scope its attributes name.
     *
     * @param event the event
     * @return completes when the event has been recorded
     */
    CompletableFuture<Void> publishEvent(Event event);
}
