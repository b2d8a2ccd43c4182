package com.p14n.fanout.consumer;

import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.data.Event;
import com.p14n.fanout.data.ScopeAttributes;
import com.p14n.fanout.registry.EventFeed;
import com.p14n.fanout.telemetry.OpenTelemetryFunctions;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Typed helpers for publishing the application's event kinds. Each event
 * carries the W3C traceparent of the span current at publish time, so
 * deliveries join the publisher's trace.
 */
public class RealtimeEvents {

    public static final String DASHBOARD_UPDATE = "dashboard_update";
    public static final String TEAM_ACTIVITY = "team_activity";
    public static final String MARKET_INTELLIGENCE = "market_intelligence";
    public static final String ASSESSMENT_COMPLETED = "assessment_completed";
    public static final String GROWTH_LEVER_UPDATED = "growth_lever_updated";
    public static final String NOTIFICATION = "notification";

    private final EventFeed feed;
    private final OpenTelemetry ot;

    public RealtimeEvents(EventFeed feed) {
        this(feed, OpenTelemetry.noop());
    }

    public RealtimeEvents(EventFeed feed, OpenTelemetry ot) {
        this.feed = feed;
        this.ot = ot;
    }

    public CompletableFuture<Void> publishDashboardUpdate(String userId, String organizationId, JsonNode metrics) {
        return publish(DASHBOARD_UPDATE, new ScopeAttributes(userId, organizationId, null), "metrics", metrics);
    }

    public CompletableFuture<Void> publishTeamActivity(String userId, String organizationId, JsonNode activity) {
        return publish(TEAM_ACTIVITY, new ScopeAttributes(userId, organizationId, null), "activity", activity);
    }

    public CompletableFuture<Void> publishAssessmentCompleted(String userId, String organizationId,
            JsonNode assessment) {
        return publish(ASSESSMENT_COMPLETED, new ScopeAttributes(userId, organizationId, null), "assessment",
                assessment);
    }

    public CompletableFuture<Void> publishMarketIntelligence(String organizationId, JsonNode insights) {
        return publish(MARKET_INTELLIGENCE, ScopeAttributes.forOrganization(organizationId), "insights", insights);
    }

    public CompletableFuture<Void> publishGrowthLeverUpdated(String userId, String organizationId, JsonNode lever) {
        return publish(GROWTH_LEVER_UPDATED, new ScopeAttributes(userId, organizationId, null), "lever", lever);
    }

    public CompletableFuture<Void> publishNotification(String userId, String title, String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("title", title);
        payload.put("message", message);
        return feed.publishEvent(create(NOTIFICATION, ScopeAttributes.forUser(userId), payload));
    }

    private CompletableFuture<Void> publish(String kind, ScopeAttributes scope, String field, JsonNode body) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.set(field, body);
        return feed.publishEvent(create(kind, scope, payload));
    }

    private Event create(String kind, ScopeAttributes scope, ObjectNode payload) {
        return Event.create(kind, scope, payload, OpenTelemetryFunctions.serializeTraceContext(ot));
    }
}
