package com.p14n.fanout.data;

/**
 * Interface for objects that can be traced and identified as they move through
 * the distribution layer.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: Unique identifier for the traceable object</li>
 * <li>{@code subject}: The kind of event carried, used as a span attribute</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the traceable object.
     *
     * @return the unique identifier string
     */
    String id();

    /**
     * Returns the kind of event this object carries.
     *
     * @return the subject string
     */
    String subject();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string, or null when the producer was not traced
     */
    String traceparent();
}
