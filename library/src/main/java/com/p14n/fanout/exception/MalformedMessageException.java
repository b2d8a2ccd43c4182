package com.p14n.fanout.exception;

/**
 * An inbound payload could not be decoded. Such payloads are logged and dropped.
 */
public class MalformedMessageException extends FanoutException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
