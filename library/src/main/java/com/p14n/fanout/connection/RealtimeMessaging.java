package com.p14n.fanout.connection;

import com.p14n.fanout.Subscription;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.OutboundMessage;
import com.p14n.fanout.data.WireMessage;

/**
 * The part of a live connection that consumer services use.
 */
public interface RealtimeMessaging {

    /**
     * Registers a handler for inbound messages of one type. Several handlers
     * may share a type; each is called for every message.
     */
    Subscription subscribeToType(MessageType type, MessageHandler handler);

    /**
     * Sends a message.
     *
     * @return the message as sent, with its id and timestamp
     * @throws com.p14n.fanout.exception.NotConnectedException if the connection
     *                                                         is not open
     */
    WireMessage send(OutboundMessage message);

    WireMessage joinRoom(String room);

    WireMessage leaveRoom(String room);
}
