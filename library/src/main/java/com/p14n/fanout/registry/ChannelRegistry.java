package com.p14n.fanout.registry;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.broker.ScopeBroker;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.ScopeKeys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multiplexes scope listeners over broker subscriptions. A channel, and with it
 * the broker subscription for its scope key, exists exactly while at least one
 * listener is registered for that key.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var registry = new ChannelRegistry(broker);
 * Subscription s = registry.subscribeToOrganization("42", event -> render(event));
 * registry.publishEvent(Event.create("dashboard_update",
 *         ScopeAttributes.forOrganization("42"), payload));
 * s.unsubscribe();
 * }</pre>
 */
public class ChannelRegistry implements EventFeed, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRegistry.class);

    private final ScopeBroker broker;
    private final Map<String, Channel> channels = new HashMap<>();
    private final Object lock = new Object();

    public ChannelRegistry(ScopeBroker broker) {
        this.broker = broker;
    }

    @Override
    public Subscription subscribeToScope(String scopeKey, ScopeListener listener) {
        if (scopeKey == null || scopeKey.trim().isEmpty()) {
            throw new IllegalArgumentException("Scope key cannot be null or empty");
        }
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }

        synchronized (lock) {
            Channel channel = channels.get(scopeKey);
            if (channel == null) {
                channel = new Channel(scopeKey);
                channel.attach(broker.subscribe(scopeKey, channel));
                channels.put(scopeKey, channel);
                logger.atDebug().addArgument(scopeKey).log("Opened channel {}");
            }
            channel.add(listener);
        }

        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                if (active.compareAndSet(true, false)) {
                    removeListener(scopeKey, listener);
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    /**
     * Subscribes to events addressed to a user.
     */
    public Subscription subscribeToUser(String userId, ScopeListener listener) {
        return subscribeToScope(ScopeKeys.user(userId), listener);
    }

    /**
     * Subscribes to events addressed to an organization.
     */
    public Subscription subscribeToOrganization(String organizationId, ScopeListener listener) {
        return subscribeToScope(ScopeKeys.org(organizationId), listener);
    }

    /**
     * Subscribes to events of the given kinds addressed to an organization. An
     * empty set of kinds accepts every event.
     */
    public Subscription subscribeToOrganization(String organizationId, Collection<String> kinds,
            ScopeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        Set<String> accepted = Set.copyOf(kinds);
        return subscribeToOrganization(organizationId, event -> {
            if (accepted.isEmpty() || accepted.contains(event.kind())) {
                listener.onEvent(event);
            }
        });
    }

    @Override
    public CompletableFuture<Void> publishEvent(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        logger.atDebug()
                .addArgument(event.kind())
                .addArgument(event.id())
                .log("Publishing {} event {}");
        return broker.publish(event);
    }

    private void removeListener(String scopeKey, ScopeListener listener) {
        synchronized (lock) {
            Channel channel = channels.get(scopeKey);
            if (channel == null) {
                return;
            }
            channel.remove(listener);
            if (channel.isEmpty()) {
                channels.remove(scopeKey);
                channel.detach();
                logger.atDebug().addArgument(scopeKey).log("Closed channel {}");
            }
        }
    }

    public boolean hasChannel(String scopeKey) {
        synchronized (lock) {
            return channels.containsKey(scopeKey);
        }
    }

    public Set<String> channelKeys() {
        synchronized (lock) {
            return new TreeSet<>(channels.keySet());
        }
    }

    public int listenerCount(String scopeKey) {
        synchronized (lock) {
            Channel channel = channels.get(scopeKey);
            return channel == null ? 0 : channel.size();
        }
    }

    /**
     * Removes every channel and its broker subscription. Outstanding
     * subscriptions become no-ops.
     */
    @Override
    public void close() {
        synchronized (lock) {
            for (Channel channel : channels.values()) {
                channel.detach();
            }
            logger.atInfo().addArgument(channels.size()).log("Closed {} channels");
            channels.clear();
        }
    }
}
