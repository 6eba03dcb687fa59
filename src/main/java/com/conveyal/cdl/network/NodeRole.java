package com.conveyal.cdl.network;

/**
 * The role a node plays in a station track layout. Roles are assigned when the node is created, with one exception:
 * the conflict zone classifier rewrites TRACK and SWITCH nodes (or any other non-signal role) to CONFLICT_ZONE once
 * it sees two or more tracks converging on them.
 */
public enum NodeRole {
    TRACK("track"),
    SWITCH("switch"),
    SIGNAL("signal"),
    CONFLICT_ZONE("cdl_zone"),
    PLATFORM("platform"),
    ENTRY_POINT("entry"),
    EXIT_POINT("exit");

    /** The name used for this role in station descriptions and reports. */
    public final String wireName;

    NodeRole (String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the role with the given wire name, or with the given enum constant name (case insensitive),
     *         or null if no role matches.
     */
    public static NodeRole forName (String name) {
        if (name == null) {
            return null;
        }
        for (NodeRole role : values()) {
            if (role.wireName.equalsIgnoreCase(name) || role.name().equalsIgnoreCase(name)) {
                return role;
            }
        }
        return null;
    }
}
