package com.p14n.fanout.exception;

/**
 * A transport failure that the connection recovers from by reconnecting.
 */
public class TransientConnectionException extends FanoutException {

    public TransientConnectionException(String message) {
        super(message);
    }

    public TransientConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
