package com.p14n.fanout.consumer;

import java.util.List;

import com.p14n.fanout.data.WireMessage;

@FunctionalInterface
public interface ChatListener {

    /**
     * @param room     the room a message arrived in
     * @param messages the room's history including the new message
     */
    void onMessages(String room, List<WireMessage> messages);
}
