package com.p14n.fanout.registry;

import com.p14n.fanout.data.Event;

/**
 * Callback for events delivered to a scope.
 */
@FunctionalInterface
public interface ScopeListener {

    void onEvent(Event event);
}
