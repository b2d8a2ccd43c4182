package com.p14n.fanout.presence;

import java.util.List;

@FunctionalInterface
public interface PresenceListener {

    /**
     * @param room         the room that changed
     * @param participants everyone now in the room, in joining order
     */
    void onPresenceChange(String room, List<String> participants);
}
