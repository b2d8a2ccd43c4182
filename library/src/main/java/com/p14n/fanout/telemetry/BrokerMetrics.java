package com.p14n.fanout.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for scope routing.
 *
 * <ul>
 * <li>events_routed: change records routed to a scope with subscribers</li>
 * <li>events_delivered: successful deliveries to a subscriber</li>
 * <li>delivery_failures: subscriber callbacks that threw</li>
 * <li>active_subscribers: current subscribers per scope</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> SCOPE = AttributeKey.stringKey("scope");

        private final LongCounter routedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter deliveryFailures;
        private final LongUpDownCounter activeSubscribers;

        public BrokerMetrics(Meter meter) {
                routedEvents = meter.counterBuilder("events_routed")
                                .setDescription("Number of change records routed to a scope")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of change records delivered to subscribers")
                                .build();

                deliveryFailures = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of subscriber callbacks that failed")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordRouted(String scopeKey) {
                routedEvents.add(1, Attributes.of(SCOPE, scopeKey));
        }

        public void recordDelivered(String scopeKey) {
                deliveredEvents.add(1, Attributes.of(SCOPE, scopeKey));
        }

        public void recordFailure(String scopeKey) {
                deliveryFailures.add(1, Attributes.of(SCOPE, scopeKey));
        }

        public void recordSubscriberAdded(String scopeKey) {
                activeSubscribers.add(1, Attributes.of(SCOPE, scopeKey));
        }

        public void recordSubscriberRemoved(String scopeKey) {
                activeSubscribers.add(-1, Attributes.of(SCOPE, scopeKey));
        }
}
