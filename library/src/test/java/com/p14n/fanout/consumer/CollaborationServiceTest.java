package com.p14n.fanout.consumer;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.p14n.fanout.data.MessageType;
import com.p14n.fanout.data.WireMessage;
import com.p14n.fanout.presence.PresenceTracker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CollaborationServiceTest {

    private RecordingMessaging messaging;
    private PresenceTracker presence;
    private CollaborationService service;

    @BeforeEach
    void setUp() {
        messaging = new RecordingMessaging();
        presence = new PresenceTracker();
        service = new CollaborationService(messaging, presence);
    }

    private void presenceMessage(String action, String sender, String room) {
        messaging.receive("p", MessageType.PRESENCE,
                JsonNodeFactory.instance.objectNode().put("action", action), sender, room);
    }

    @Test
    void presenceMessagesUpdateCollaborators() {
        List<List<String>> seen = new CopyOnWriteArrayList<>();
        service.onPresenceChange("board", (room, participants) -> seen.add(participants));

        presenceMessage("join", "ann", "board");
        presenceMessage("join", "bob", "board");
        presenceMessage("join", "ann", "board");
        presenceMessage("leave", "ann", "board");

        assertEquals(List.of("bob"), service.getCollaborators("board"));
        assertEquals(List.of(List.of("ann"), List.of("ann", "bob"), List.of("bob")), seen);
    }

    @Test
    void missingSenderAndRoomUseDefaults() {
        presenceMessage("join", null, null);

        assertEquals(List.of("unknown"), service.getCollaborators(ChatService.DEFAULT_ROOM));
    }

    @Test
    void unknownActionsAreIgnored() {
        presenceMessage("wave", "ann", "board");

        assertTrue(service.getCollaborators("board").isEmpty());
    }

    @Test
    void collaborationMessagesReachListeners() {
        List<String> seen = new CopyOnWriteArrayList<>();
        service.onCollaboration(m -> seen.add(m.id()));

        messaging.receive("c1", MessageType.COLLABORATION, null, "ann", "board");

        assertEquals(List.of("c1"), seen);
    }

    @Test
    void joinCollaborationSendsPresence() {
        WireMessage sent = service.joinCollaboration("board", "ann");
        service.leaveCollaboration("board", "ann");

        assertEquals(MessageType.PRESENCE, sent.type());
        assertEquals("board", sent.room());
        assertEquals("ann", sent.sender());
        assertEquals("join", sent.data().get("action").asText());
        assertEquals("ann", sent.data().get("userId").asText());
        assertEquals("leave", messaging.sent.get(1).data().get("action").asText());
    }
}
