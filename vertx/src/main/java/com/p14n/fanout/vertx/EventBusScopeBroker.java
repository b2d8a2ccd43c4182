package com.p14n.fanout.vertx;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.broker.MessageSubscriber;
import com.p14n.fanout.broker.ScopeRoutingBroker;
import com.p14n.fanout.codec.EventRecordCodec;
import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.exception.PublishFailureException;
import com.p14n.fanout.vertx.codec.ChangeRecordCodec;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A scope broker carried by the Vert.x EventBus. Every scope key of a published
 * event gets its own EventBus message, so a clustered EventBus fans events out
 * across processes while each node only consumes the scope keys it has
 * subscribers for.
 *
 * <p>
 * Events are not persisted. Use the Postgres backing when events must survive
 * a restart of the publisher.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Vertx vertx = Vertx.vertx();
 * EventBusScopeBroker broker = new EventBusScopeBroker(vertx.eventBus(), OpenTelemetry.noop());
 * ChannelRegistry registry = new ChannelRegistry(broker);
 *
 * registry.subscribeToUser("u1", event -> System.out.println("Received: " + event));
 * registry.publishEvent(event);
 * }</pre>
 */
public class EventBusScopeBroker extends ScopeRoutingBroker {

    private static final Logger logger = LoggerFactory.getLogger(EventBusScopeBroker.class);

    static final String ADDRESS_PREFIX = "fanout.";

    private final EventBus eventBus;
    private final Map<String, MessageConsumer<ChangeRecord>> consumers = new HashMap<>();

    public EventBusScopeBroker(EventBus eventBus, OpenTelemetry ot) {
        super(ot, "event_bus_scope_broker");
        this.eventBus = eventBus;

        try {
            eventBus.registerDefaultCodec(ChangeRecord.class, new ChangeRecordCodec());
        } catch (IllegalStateException e) {
            logger.atDebug()
                    .setCause(e)
                    .log("ChangeRecord codec already registered on this EventBus");
        }
    }

    static String address(String scopeKey) {
        return ADDRESS_PREFIX + scopeKey;
    }

    @Override
    public CompletableFuture<Void> publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (isClosed()) {
            return CompletableFuture.failedFuture(
                    new PublishFailureException(event.id(), new IllegalStateException("Broker is closed")));
        }
        try {
            ChangeRecord record = EventRecordCodec.toChangeRecord(event);
            for (String scopeKey : record.scopeKeys()) {
                eventBus.publish(address(scopeKey), record);
            }
            logger.atDebug()
                    .addArgument(event.id())
                    .addArgument(record.scopeKeys())
                    .log("Published {} to EventBus addresses for {}");
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            logger.atError()
                    .addArgument(event.id())
                    .setCause(e)
                    .log("Failed to publish event {} to the EventBus");
            return CompletableFuture.failedFuture(new PublishFailureException(event.id(), e));
        }
    }

    @Override
    public Subscription subscribe(String scopeKey, MessageSubscriber<String> subscriber) {
        Subscription routed;
        synchronized (consumers) {
            routed = super.subscribe(scopeKey, subscriber);
            consumers.computeIfAbsent(scopeKey, this::register);
        }
        return new Subscription() {
            @Override
            public void unsubscribe() {
                synchronized (consumers) {
                    routed.unsubscribe();
                    if (!hasSubscribers(scopeKey)) {
                        MessageConsumer<ChangeRecord> consumer = consumers.remove(scopeKey);
                        if (consumer != null) {
                            consumer.unregister();
                            logger.atDebug().addArgument(scopeKey).log("Stopped consuming scope {}");
                        }
                    }
                }
            }

            @Override
            public boolean isActive() {
                return routed.isActive();
            }
        };
    }

    private MessageConsumer<ChangeRecord> register(String scopeKey) {
        String address = address(scopeKey);
        MessageConsumer<ChangeRecord> consumer = eventBus.consumer(address);
        consumer.handler(message -> {
            ChangeRecord record = message.body();
            logger.atDebug()
                    .addArgument(scopeKey)
                    .addArgument(record.id())
                    .log("Received event on scope {} with id {}");
            try {
                deliver(scopeKey, record);
            } catch (Exception e) {
                logger.atError()
                        .addArgument(scopeKey)
                        .addArgument(record.id())
                        .setCause(e)
                        .log("Error delivering event on scope {} with id {}");
            }
        });
        logger.atInfo()
                .addArgument(scopeKey)
                .addArgument(address)
                .log("Consuming scope {} at address {}");
        return consumer;
    }

    /**
     * Returns whether this node currently consumes the EventBus address of a
     * scope key.
     *
     * @param scopeKey the scope key
     * @return true when a consumer is registered
     */
    public boolean isConsuming(String scopeKey) {
        synchronized (consumers) {
            return consumers.containsKey(scopeKey);
        }
    }

    @Override
    public void close() {
        logger.atInfo().log("Closing EventBusScopeBroker");
        synchronized (consumers) {
            consumers.values().forEach(MessageConsumer::unregister);
            consumers.clear();
        }
        super.close();
    }
}
