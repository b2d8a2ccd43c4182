package com.p14n.fanout.broker;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.p14n.fanout.codec.EventRecordCodec;
import com.p14n.fanout.data.ChangeRecord;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.exception.PublishFailureException;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Non-durable backing. Each published event is encoded to its record form and
 * routed through the notifier, which runs routing on the publishing thread
 * unless another executor is given.
 */
public class InMemoryScopeBroker extends ScopeRoutingBroker {

    private final Executor notifier;

    public InMemoryScopeBroker(OpenTelemetry ot) {
        this(Runnable::run, ot);
    }

    public InMemoryScopeBroker(Executor notifier, OpenTelemetry ot) {
        super(ot, "in_memory_scope_broker");
        this.notifier = notifier;
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
        ChangeRecord record;
        try {
            record = EventRecordCodec.toChangeRecord(event);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new PublishFailureException(event.id(), e));
        }
        try {
            notifier.execute(() -> route(record));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new PublishFailureException(event.id(), e));
        }
        return CompletableFuture.completedFuture(null);
    }
}
