package com.p14n.fanout.data;

/**
 * Builds the scope keys that name an audience for events.
 *
 * <pre>{@code
 * ScopeKeys.user("7")      // user:7
 * ScopeKeys.org("42")      // org:42
 * ScopeKeys.room("board")  // room:board
 * }</pre>
 */
public final class ScopeKeys {

    public static final String USER_PREFIX = "user:";
    public static final String ORG_PREFIX = "org:";
    public static final String ROOM_PREFIX = "room:";

    private ScopeKeys() {
    }

    public static String user(String userId) {
        return USER_PREFIX + requireId(userId, "userId");
    }

    public static String org(String organizationId) {
        return ORG_PREFIX + requireId(organizationId, "organizationId");
    }

    public static String room(String room) {
        return ROOM_PREFIX + requireId(room, "room");
    }

    private static String requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }
}
