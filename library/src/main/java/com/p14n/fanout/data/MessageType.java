package com.p14n.fanout.data;

/**
 * The kinds of message carried over a real-time connection.
 */
public enum MessageType {

    NOTIFICATION("notification"),
    CHAT("chat"),
    /**
     * Control messages, e.g. joining or leaving a room.
     */
    UPDATE("update"),
    PRESENCE("presence"),
    ACTIVITY("activity"),
    COLLABORATION("collaboration");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used in the JSON {@code type} field.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name.
     *
     * @param wireName the value of the {@code type} field
     * @return the message type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MessageType fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + wireName);
    }
}
