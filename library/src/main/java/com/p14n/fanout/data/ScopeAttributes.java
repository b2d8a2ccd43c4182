package com.p14n.fanout.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The audience attributes of an event. Any combination may be present; each
 * present attribute maps to one scope key.
 *
 * @param userId         the user the event concerns, may be null
 * @param organizationId the organization the event concerns, may be null
 * @param room           the room the event concerns, may be null
 */
public record ScopeAttributes(String userId, String organizationId, String room) {

    public static ScopeAttributes forUser(String userId) {
        return new ScopeAttributes(userId, null, null);
    }

    public static ScopeAttributes forOrganization(String organizationId) {
        return new ScopeAttributes(null, organizationId, null);
    }

    public static ScopeAttributes forRoom(String room) {
        return new ScopeAttributes(null, null, room);
    }

    public ScopeAttributes withUser(String userId) {
        return new ScopeAttributes(userId, organizationId, room);
    }

    public ScopeAttributes withOrganization(String organizationId) {
        return new ScopeAttributes(userId, organizationId, room);
    }

    public ScopeAttributes withRoom(String room) {
        return new ScopeAttributes(userId, organizationId, room);
    }

    /**
     * Returns the scope keys these attributes match, always ordered user, org,
     * room.
     *
     * @return an unmodifiable list of scope keys, empty if no attribute is set
     */
    public List<String> scopeKeys() {
        List<String> keys = new ArrayList<>(3);
        if (present(userId)) {
            keys.add(ScopeKeys.user(userId));
        }
        if (present(organizationId)) {
            keys.add(ScopeKeys.org(organizationId));
        }
        if (present(room)) {
            keys.add(ScopeKeys.room(room));
        }
        return Collections.unmodifiableList(keys);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
