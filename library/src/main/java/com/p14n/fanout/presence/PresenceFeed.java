package com.p14n.fanout.presence;

import java.util.List;

import com.p14n.fanout.Subscription;

/**
 * Room membership as seen by consumer services.
 */
public interface PresenceFeed {

    /**
     * Adds a participant to a room. Joining twice changes nothing.
     *
     * @return true if the participant was not in the room yet
     */
    boolean join(String room, String participantId);

    /**
     * Removes a participant from a room. Leaving a room one is not in changes
     * nothing.
     *
     * @return true if the participant was in the room
     */
    boolean leave(String room, String participantId);

    /**
     * Registers a listener that receives the full participant list after each
     * change to the room.
     */
    Subscription onPresenceChange(String room, PresenceListener listener);

    /**
     * Returns the participants of a room in joining order.
     *
     * @param room the room
     * @return the participants, empty for an unknown room
     */
    List<String> participants(String room);
}
