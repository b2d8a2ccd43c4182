package com.p14n.fanout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import javax.sql.DataSource;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.fanout.broker.DefaultExecutor;
import com.p14n.fanout.broker.PostgresScopeBroker;
import com.p14n.fanout.connection.ConnectionManager;
import com.p14n.fanout.data.ConfigData;
import com.p14n.fanout.data.ConnectionConfig;
import com.p14n.fanout.db.DatabaseSetup;
import com.p14n.fanout.telemetry.OpenTelemetryFunctions;
import com.p14n.fanout.vertx.VertxWebSocketTransport;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fan-out node. Configured through environment variables:
 * <ul>
 * <li>{@code APP_DB_HOST}, {@code APP_DB_PORT}, {@code APP_DB_USER},
 * {@code APP_DB_PASSWORD}, {@code APP_DB_NAME}: the event store</li>
 * <li>{@code APP_WS_URL}, {@code APP_WS_TOKEN}: optional socket endpoint for
 * notifications, chat and collaboration</li>
 * <li>{@code APP_WATCH_ORGS}: comma separated organizations whose events are
 * logged</li>
 * <li>{@code APP_PUBLISH_ORG}: when set, publishes dashboard updates for this
 * organization continuously</li>
 * <li>{@code APP_OTEL_ENDPOINT}: OTLP collector, telemetry is off when
 * unset</li>
 * </ul>
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static String[] envVals(Map<String, String> env, String name) {
        String e = env.get(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return new String[] {};
    }

    static String env(Map<String, String> env, String name, String fallback) {
        String e = env.get(name);
        return e == null || e.isBlank() ? fallback : e;
    }

    static ConfigData storeConfig(Map<String, String> env, String affinity) {
        return new ConfigData(
                affinity,
                env(env, "APP_DB_HOST", "localhost"),
                Integer.parseInt(env(env, "APP_DB_PORT", "5432")),
                env(env, "APP_DB_USER", "postgres"),
                env(env, "APP_DB_PASSWORD", "postgres"),
                env(env, "APP_DB_NAME", "postgres"),
                Integer.parseInt(env(env, "APP_POLL_INTERVAL", "100")));
    }

    static ConnectionConfig connectionConfig(Map<String, String> env) {
        String url = env(env, "APP_WS_URL", null);
        if (url == null) {
            return null;
        }
        return new ConnectionConfig(url, env(env, "APP_WS_TOKEN", null));
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        String affinity = UUID.randomUUID().toString().substring(0, 8);
        logger.atInfo().addArgument(affinity).log("Starting fan-out node {}");
        run(env, affinity);
    }

    private static void close(AutoCloseable c) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn()
                    .addArgument(c.getClass().getSimpleName())
                    .setCause(e)
                    .log("Error closing {}");
        }
    }

    private static void publishContinuously(RealtimeServices services, String organizationId, OpenTelemetry ot)
            throws InterruptedException {
        var gap = 1000;
        var direction = -1;
        Tracer tracer = ot.getTracer("fanout");
        while (!Thread.currentThread().isInterrupted()) {
            ObjectNode metrics = JsonNodeFactory.instance.objectNode();
            metrics.put("overallScore", ThreadLocalRandom.current().nextInt(0, 101));
            OpenTelemetryFunctions.processWithTelemetry(tracer, "publish_dashboard_update", () -> services.events()
                    .publishDashboardUpdate(null, organizationId, metrics)
                    .whenComplete((v, e) -> {
                        if (e != null) {
                            logger.atWarn()
                                    .addArgument(organizationId)
                                    .setCause(e)
                                    .log("Dashboard update for {} was not published");
                        }
                    }));
            gap += direction * 10;
            if (gap < 10) {
                direction = 1;
            } else if (gap > 1000) {
                direction = -1;
            }
            Thread.sleep(gap);
        }
    }

    private static void run(Map<String, String> env, String affinity) throws InterruptedException {
        List<AutoCloseable> resources = new ArrayList<>();

        String otelEndpoint = env(env, "APP_OTEL_ENDPOINT", null);
        OpenTelemetry ot = OpenTelemetry.noop();
        if (otelEndpoint != null) {
            var sdk = Opentelemetry.create("fanout", otelEndpoint);
            resources.add(sdk);
            ot = sdk;
        }

        ConfigData cfg = storeConfig(env, affinity);
        DataSource ds = DatabaseSetup.createPool(cfg);
        if (ds instanceof AutoCloseable) {
            resources.add((AutoCloseable) ds);
        }

        PostgresScopeBroker broker = new PostgresScopeBroker(ds, cfg, ot);

        ConnectionManager connection = null;
        ConnectionConfig connectionConfig = connectionConfig(env);
        if (connectionConfig != null) {
            Vertx vertx = Vertx.vertx();
            resources.add(() -> vertx.close());
            VertxWebSocketTransport transport = new VertxWebSocketTransport(vertx);
            resources.add(transport);
            DefaultExecutor scheduler = new DefaultExecutor(1);
            resources.add(scheduler);
            connection = new ConnectionManager(connectionConfig, transport, scheduler);
        }

        RealtimeServices services = new RealtimeServices(broker, connection, ot);
        resources.add(services);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            List<AutoCloseable> reversed = new ArrayList<>(resources);
            Collections.reverse(reversed);
            reversed.forEach(App::close);
        }, "fanout-shutdown"));

        broker.start();

        for (String org : envVals(env, "APP_WATCH_ORGS")) {
            services.registry().subscribeToOrganization(org, event -> logger.atInfo()
                    .addArgument(event.kind())
                    .addArgument(org)
                    .addArgument(event.payload())
                    .log("Received {} for organization {}: {}"));
        }

        if (connection != null) {
            services.notifications().onNotification(message -> logger.atInfo()
                    .addArgument(message.data())
                    .log("Notification: {}"));
            connection.connect().whenComplete((v, e) -> {
                if (e != null) {
                    logger.atWarn().setCause(e).log("Initial connection failed");
                }
            });
        }

        String publishOrg = env(env, "APP_PUBLISH_ORG", null);
        if (publishOrg != null) {
            publishContinuously(services, publishOrg, ot);
        } else {
            Thread.currentThread().join();
        }
    }
}
