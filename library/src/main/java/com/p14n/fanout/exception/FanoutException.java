package com.p14n.fanout.exception;

/**
 * Base class of the failures raised by the distribution layer.
 */
public class FanoutException extends RuntimeException {

    public FanoutException(String message) {
        super(message);
    }

    public FanoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
