package com.p14n.fanout.connection;

import com.p14n.fanout.exception.FanoutException;

/**
 * Observes connection transitions.
 */
@FunctionalInterface
public interface ConnectionListener {

    /**
     * @param status the transition
     * @param cause  the failure behind it, or null for a normal transition
     */
    void onConnectionChange(ConnectionStatus status, FanoutException cause);
}
