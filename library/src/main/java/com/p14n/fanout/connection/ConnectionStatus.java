package com.p14n.fanout.connection;

/**
 * Transitions reported to {@link ConnectionListener}s.
 */
public enum ConnectionStatus {
    /** The transport opened. */
    CONNECTED,
    /** The transport closed, cleanly or not. */
    DISCONNECTED,
    /** The transport reported an error. */
    ERROR,
    /** A reconnect attempt has been scheduled. */
    RECONNECTING,
    /** Reconnect attempts are exhausted. */
    TERMINATED
}
