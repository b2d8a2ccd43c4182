package com.p14n.fanout.vertx;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.p14n.fanout.Subscription;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.ScopeAttributes;
import com.p14n.fanout.exception.PublishFailureException;
import com.p14n.fanout.registry.ChannelRegistry;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class EventBusScopeBrokerTest {

    private Vertx vertx;
    private EventBusScopeBroker broker;
    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        broker = new EventBusScopeBroker(vertx.eventBus(), OpenTelemetry.noop());
        registry = new ChannelRegistry(broker);
    }

    @AfterEach
    void tearDown() throws Exception {
        registry.close();
        broker.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static Event teamActivity(ScopeAttributes scope) {
        return Event.create("team_activity", scope,
                JsonNodeFactory.instance.objectNode().put("activity", "deployed"));
    }

    @Test
    void deliversToEachMatchingScopeOnce() throws Exception {
        BlockingQueue<Event> user = new LinkedBlockingQueue<>();
        BlockingQueue<Event> org = new LinkedBlockingQueue<>();
        BlockingQueue<Event> otherOrg = new LinkedBlockingQueue<>();
        registry.subscribeToUser("u1", user::add);
        registry.subscribeToOrganization("42", org::add);
        registry.subscribeToOrganization("7", otherOrg::add);

        Event event = teamActivity(new ScopeAttributes("u1", "42", null));
        registry.publishEvent(event).get(5, TimeUnit.SECONDS);

        Event toUser = user.poll(5, TimeUnit.SECONDS);
        Event toOrg = org.poll(5, TimeUnit.SECONDS);
        assertNotNull(toUser);
        assertNotNull(toOrg);
        assertEquals(event.id(), toUser.id());
        assertEquals("deployed", toOrg.payload().get("activity").asText());

        assertNull(user.poll(200, TimeUnit.MILLISECONDS));
        assertNull(org.poll(10, TimeUnit.MILLISECONDS));
        assertTrue(otherOrg.isEmpty());
    }

    @Test
    void consumesAddressOnlyWhileSubscribed() {
        Subscription first = broker.subscribe("room:general", record -> {
        });
        Subscription second = broker.subscribe("room:general", record -> {
        });
        assertTrue(broker.isConsuming("room:general"));

        first.unsubscribe();
        assertTrue(broker.isConsuming("room:general"));

        second.unsubscribe();
        second.unsubscribe();
        assertFalse(broker.isConsuming("room:general"));
        assertFalse(second.isActive());
    }

    @Test
    void failingListenerDoesNotStopOthers() throws Exception {
        BlockingQueue<Event> healthy = new LinkedBlockingQueue<>();
        registry.subscribeToScope("room:room-1", event -> {
            throw new IllegalStateException("listener failed");
        });
        registry.subscribeToScope("room:room-1", healthy::add);

        registry.publishEvent(teamActivity(ScopeAttributes.forRoom("room-1"))).get(5, TimeUnit.SECONDS);

        assertNotNull(healthy.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void publishFailsOnceClosed() {
        broker.close();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> broker.publish(teamActivity(ScopeAttributes.forUser("u1"))).get(5, TimeUnit.SECONDS));
        assertInstanceOf(PublishFailureException.class, e.getCause());
    }
}
