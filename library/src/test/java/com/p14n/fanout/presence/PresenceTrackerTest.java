package com.p14n.fanout.presence;

import com.p14n.fanout.Subscription;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PresenceTrackerTest {

    private final PresenceTracker tracker = new PresenceTracker();

    @Test
    void broadcastsFullListOnEachChange() {
        List<List<String>> seen = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> seen.add(participants));

        tracker.join("board", "ann");
        tracker.join("board", "bob");
        tracker.leave("board", "ann");

        assertEquals(List.of(List.of("ann"), List.of("ann", "bob"), List.of("bob")), seen);
    }

    @Test
    void joiningTwiceIsIdempotent() {
        List<List<String>> seen = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> seen.add(participants));

        assertTrue(tracker.join("board", "ann"));
        assertFalse(tracker.join("board", "ann"));

        assertEquals(1, seen.size());
        assertEquals(List.of("ann"), tracker.participants("board"));
    }

    @Test
    void leavingWhenAbsentChangesNothing() {
        List<List<String>> seen = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> seen.add(participants));

        assertFalse(tracker.leave("board", "ann"));
        assertFalse(tracker.leave("unknown", "ann"));

        assertTrue(seen.isEmpty());
    }

    @Test
    void roomsAreIndependent() {
        List<String> rooms = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> rooms.add(room));

        tracker.join("other", "ann");

        assertTrue(rooms.isEmpty());
        assertEquals(List.of(), tracker.participants("board"));
        assertEquals(List.of("ann"), tracker.participants("other"));
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<String> calls = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> {
            throw new IllegalStateException("boom");
        });
        tracker.onPresenceChange("board", (room, participants) -> calls.add(room));

        tracker.join("board", "ann");

        assertEquals(List.of("board"), calls);
    }

    @Test
    void listenerReceivesAnImmutableSnapshot() {
        List<List<String>> seen = new CopyOnWriteArrayList<>();
        tracker.onPresenceChange("board", (room, participants) -> seen.add(participants));

        tracker.join("board", "ann");
        tracker.join("board", "bob");

        assertEquals(List.of("ann"), seen.get(0));
        assertThrows(UnsupportedOperationException.class, () -> seen.get(0).add("eve"));
    }

    @Test
    void idleRoomsAreForgotten() {
        Subscription s = tracker.onPresenceChange("board", (room, participants) -> {
        });
        tracker.join("board", "ann");
        tracker.leave("board", "ann");
        assertTrue(tracker.isTracked("board"));

        s.unsubscribe();
        assertFalse(tracker.isTracked("board"));
    }
}
