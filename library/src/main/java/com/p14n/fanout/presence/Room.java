package com.p14n.fanout.presence;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.p14n.fanout.data.ScopeKeys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Participants and presence listeners of one room. Listeners are called
 * outside the room's lock with a snapshot of the participants.
 */
class Room {

    private static final Logger logger = LoggerFactory.getLogger(Room.class);

    private final String name;
    private final Set<String> participants = new LinkedHashSet<>();
    private final Set<PresenceListener> listeners = new LinkedHashSet<>();

    Room(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    String scopeKey() {
        return ScopeKeys.room(name);
    }

    synchronized boolean join(String participantId) {
        return participants.add(participantId);
    }

    synchronized boolean leave(String participantId) {
        return participants.remove(participantId);
    }

    synchronized void addListener(PresenceListener listener) {
        listeners.add(listener);
    }

    synchronized void removeListener(PresenceListener listener) {
        listeners.remove(listener);
    }

    synchronized List<String> participants() {
        return List.copyOf(participants);
    }

    synchronized boolean isIdle() {
        return participants.isEmpty() && listeners.isEmpty();
    }

    void broadcast() {
        List<String> snapshot;
        List<PresenceListener> targets;
        synchronized (this) {
            snapshot = List.copyOf(participants);
            targets = new ArrayList<>(listeners);
        }
        for (PresenceListener listener : targets) {
            try {
                listener.onPresenceChange(name, snapshot);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(scopeKey())
                        .setCause(e)
                        .log("Presence listener failed on {}");
            }
        }
    }
}
