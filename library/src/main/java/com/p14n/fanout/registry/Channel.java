package com.p14n.fanout.registry;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.broker.MessageSubscriber;
import com.p14n.fanout.codec.EventRecordCodec;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.exception.MalformedMessageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The listeners of one scope key, sharing a single broker subscription.
 * Listeners are called in the order they were added.
 */
class Channel implements MessageSubscriber<String> {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private final String scopeKey;
    private final Set<ScopeListener> listeners = new CopyOnWriteArraySet<>();
    private Subscription subscription;

    Channel(String scopeKey) {
        this.scopeKey = scopeKey;
    }

    void attach(Subscription subscription) {
        this.subscription = subscription;
    }

    void detach() {
        listeners.clear();
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    boolean add(ScopeListener listener) {
        return listeners.add(listener);
    }

    boolean remove(ScopeListener listener) {
        return listeners.remove(listener);
    }

    boolean isEmpty() {
        return listeners.isEmpty();
    }

    int size() {
        return listeners.size();
    }

    String scopeKey() {
        return scopeKey;
    }

    @Override
    public void onMessage(String record) {
        Event event;
        try {
            event = EventRecordCodec.decode(record);
        } catch (MalformedMessageException e) {
            logger.atWarn()
                    .addArgument(scopeKey)
                    .setCause(e)
                    .log("Dropping malformed change record on {}");
            return;
        }

        for (ScopeListener listener : listeners) {
            // skip listeners removed while this event is being delivered
            if (!listeners.contains(listener)) {
                continue;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(event.id())
                        .addArgument(scopeKey)
                        .setCause(e)
                        .log("Listener failed to handle event {} on {}");
            }
        }
    }

    @Override
    public void onError(Throwable error) {
        logger.atWarn()
                .addArgument(scopeKey)
                .setCause(error)
                .log("Delivery failed on {}");
    }
}
