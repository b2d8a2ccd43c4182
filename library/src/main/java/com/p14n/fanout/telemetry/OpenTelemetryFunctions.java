package com.p14n.fanout.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.fanout.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private static final TextMapGetter<Map<String, String>> MAP_GETTER = new TextMapGetter<>() {
                @Override
                public Iterable<String> keys(Map<String, String> carrier) {
                        return carrier.keySet();
                }

                @Override
                public String get(Map<String, String> carrier, String key) {
                        return carrier == null ? null : carrier.get(key);
                }
        };

        private OpenTelemetryFunctions() {
        }

        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get("traceparent");
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put("traceparent", traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier, MAP_GETTER);
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String scopeKey,
                        String eventId, String kind, String traceparent, Supplier<T> action) {

                Context parentContext = traceparent == null ? null
                                : OpenTelemetryFunctions.deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("event.id", eventId == null ? "" : eventId)
                                .setAttribute("event.kind", kind == null ? "" : kind);
                if (scopeKey != null) {
                        sb.setAttribute("scope", scopeKey);
                }
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable traceable,
                        String scopeKey, String spanName, Supplier<T> action) {
                return processWithTelemetry(ot, tracer, spanName, scopeKey, traceable.id(), traceable.subject(),
                                traceable.traceparent(), action);
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, Supplier<T> action) {
                Span span = tracer.spanBuilder(spanName).startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
