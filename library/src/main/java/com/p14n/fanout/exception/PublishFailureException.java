package com.p14n.fanout.exception;

/**
 * The durable write of an event failed. It is not retried; the caller decides
 * whether to publish again.
 */
public class PublishFailureException extends FanoutException {

    private final String eventId;

    public PublishFailureException(String eventId, Throwable cause) {
        super("Failed to publish event " + eventId, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
