package com.p14n.fanout.connection;

/**
 * Lifecycle state of a {@link ConnectionManager}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
