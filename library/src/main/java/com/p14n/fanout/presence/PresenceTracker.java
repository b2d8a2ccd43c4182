package com.p14n.fanout.presence;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.fanout.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process room membership. Rooms are created on first use and forgotten
 * once they have neither participants nor listeners.
 */
public class PresenceTracker implements PresenceFeed {

    private static final Logger logger = LoggerFactory.getLogger(PresenceTracker.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();

    @Override
    public boolean join(String room, String participantId) {
        requireName(room, "Room");
        requireName(participantId, "Participant id");
        boolean[] changed = new boolean[1];
        Room joined = rooms.compute(room, (name, existing) -> {
            Room r = existing == null ? new Room(name) : existing;
            changed[0] = r.join(participantId);
            return r;
        });
        if (changed[0]) {
            joined.broadcast();
            logger.atDebug().addArgument(participantId).addArgument(room).log("{} joined {}");
        }
        return changed[0];
    }

    @Override
    public boolean leave(String room, String participantId) {
        requireName(room, "Room");
        requireName(participantId, "Participant id");
        boolean[] changed = new boolean[1];
        Room[] left = new Room[1];
        rooms.computeIfPresent(room, (name, r) -> {
            changed[0] = r.leave(participantId);
            left[0] = r;
            return r.isIdle() ? null : r;
        });
        if (changed[0]) {
            left[0].broadcast();
            logger.atDebug().addArgument(participantId).addArgument(room).log("{} left {}");
        }
        return changed[0];
    }

    @Override
    public Subscription onPresenceChange(String room, PresenceListener listener) {
        requireName(room, "Room");
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        rooms.compute(room, (name, existing) -> {
            Room r = existing == null ? new Room(name) : existing;
            r.addListener(listener);
            return r;
        });
        AtomicBoolean active = new AtomicBoolean(true);
        return new Subscription() {
            @Override
            public void unsubscribe() {
                if (active.compareAndSet(true, false)) {
                    rooms.computeIfPresent(room, (name, r) -> {
                        r.removeListener(listener);
                        return r.isIdle() ? null : r;
                    });
                }
            }

            @Override
            public boolean isActive() {
                return active.get();
            }
        };
    }

    @Override
    public List<String> participants(String room) {
        Room r = rooms.get(room);
        return r == null ? List.of() : r.participants();
    }

    public boolean isTracked(String room) {
        return rooms.containsKey(room);
    }

    private static void requireName(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
    }
}
