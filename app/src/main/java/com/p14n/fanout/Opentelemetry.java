package com.p14n.fanout;

import java.time.Duration;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

/**
 * Builds the SDK exporting spans and the broker metrics to an OTLP collector.
 */
public class Opentelemetry {

        static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
        static final Duration METRIC_INTERVAL = Duration.ofSeconds(30);

        static Resource resource(String serviceName) {
                return Resource.getDefault().merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
        }

        public static OpenTelemetrySdk create(String serviceName, String collectorEndpoint) {
                Resource resource = resource(serviceName);

                OtlpGrpcMetricExporter metricExporter = OtlpGrpcMetricExporter.builder()
                                .setEndpoint(collectorEndpoint)
                                .build();
                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .registerMetricReader(PeriodicMetricReader.builder(metricExporter)
                                                .setInterval(METRIC_INTERVAL)
                                                .build())
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(collectorEndpoint)
                                .build();
                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .setResource(resource)
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }
}
