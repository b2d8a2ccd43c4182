package com.p14n.fanout.exception;

import com.p14n.fanout.connection.ConnectionState;

/**
 * Thrown when a message is sent while the connection is not open.
 */
public class NotConnectedException extends FanoutException {

    private final ConnectionState state;

    public NotConnectedException(ConnectionState state) {
        super("Connection is not connected (state " + state + ")");
        this.state = state;
    }

    public ConnectionState getState() {
        return state;
    }
}
