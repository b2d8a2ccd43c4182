package com.p14n.fanout.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.fanout.data.Traceable;
import com.p14n.fanout.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.fanout.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Topic based broker that delivers synchronously on the publishing thread.
 * Subscribers of a topic are called one after another in the order they
 * subscribed; a subscriber that throws is logged and told through
 * {@link MessageSubscriber#onError}, and delivery continues with the next one.
 *
 * @param <InT>  The type of messages published
 * @param <OutT> The type of messages delivered
 */
public abstract class DefaultMessageBroker<InT extends Traceable, OutT>
        implements MessageBroker<InT, OutT>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    protected final ConcurrentHashMap<String, Set<MessageSubscriber<OutT>>> topicSubscribers = new ConcurrentHashMap<>();
    protected final AtomicBoolean closed = new AtomicBoolean(false);
    protected final BrokerMetrics metrics;
    protected final Tracer tracer;
    protected final OpenTelemetry openTelemetry;

    public DefaultMessageBroker(OpenTelemetry ot, String scopeName) {
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
        this.tracer = ot.getTracer(scopeName);
        this.openTelemetry = ot;
    }

    protected boolean canProcess(String topic, InT message) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        Set<MessageSubscriber<OutT>> subscribers = topicSubscribers.get(topic);
        return subscribers != null && !subscribers.isEmpty();
    }

    @Override
    public void publish(String topic, InT message) {
        if (!canProcess(topic, message)) {
            logger.atTrace()
                    .addArgument(message.id())
                    .addArgument(topic)
                    .log("Dropping {} as {} has no subscribers");
            return;
        }

        metrics.recordRouted(topic);

        Set<MessageSubscriber<OutT>> subscribers = topicSubscribers.get(topic);
        if (subscribers != null) {
            processWithTelemetry(openTelemetry, tracer, message, topic, "route_event", () -> {
                for (MessageSubscriber<OutT> subscriber : subscribers) {
                    deliver(topic, message, subscriber);
                }
                return null;
            });
        }
    }

    private void deliver(String topic, InT message, MessageSubscriber<OutT> subscriber) {
        try {
            subscriber.onMessage(convert(message));
            metrics.recordDelivered(topic);
        } catch (RuntimeException e) {
            metrics.recordFailure(topic);
            logger.atWarn()
                    .addArgument(message.id())
                    .addArgument(topic)
                    .setCause(e)
                    .log("Subscriber failed to process {} on {}");
            try {
                subscriber.onError(e);
            } catch (RuntimeException onErrorFailure) {
                logger.atWarn()
                        .addArgument(topic)
                        .setCause(onErrorFailure)
                        .log("Subscriber error handler failed on {}");
            }
        }
    }

    @Override
    public boolean subscribe(String topic, MessageSubscriber<OutT> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        boolean[] added = new boolean[1];
        topicSubscribers.compute(topic, (key, subscribers) -> {
            Set<MessageSubscriber<OutT>> s = subscribers == null ? new CopyOnWriteArraySet<>() : subscribers;
            added[0] = s.add(subscriber);
            return s;
        });

        if (added[0]) {
            metrics.recordSubscriberAdded(topic);
        }

        return added[0];
    }

    @Override
    public boolean unsubscribe(String topic, MessageSubscriber<OutT> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        boolean[] removed = new boolean[1];
        topicSubscribers.computeIfPresent(topic, (key, subscribers) -> {
            removed[0] = subscribers.remove(subscriber);
            return subscribers.isEmpty() ? null : subscribers;
        });

        if (removed[0]) {
            metrics.recordSubscriberRemoved(topic);
        }
        return removed[0];
    }

    @Override
    public boolean hasSubscribers(String topic) {
        return topicSubscribers.containsKey(topic);
    }

    @Override
    public void close() {
        closed.set(true);
        topicSubscribers.clear();
    }

}
