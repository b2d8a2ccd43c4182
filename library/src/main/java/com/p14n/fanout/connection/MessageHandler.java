package com.p14n.fanout.connection;

import com.p14n.fanout.data.WireMessage;

@FunctionalInterface
public interface MessageHandler {

    void onMessage(WireMessage message);
}
