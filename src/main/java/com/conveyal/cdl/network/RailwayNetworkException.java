package com.conveyal.cdl.network;

/**
 * Thrown when a station network cannot be built or queried as requested.
 * The type allows callers (and tests) to distinguish the kinds of failure without parsing messages.
 */
public class RailwayNetworkException extends RuntimeException {

    public final Type type;

    public enum Type {
        /** An edge refers to a node that does not exist in the network. */
        REFERENTIAL_INTEGRITY,
        /** A station description could not be parsed or contains values that cannot be interpreted. */
        INVALID_DESCRIPTION,
        /** An analysis was requested on a node id that is not present in the network. */
        UNKNOWN_NODE
    }

    public static RailwayNetworkException referentialIntegrity (TrackEdge edge, String missingNodeId) {
        return new RailwayNetworkException(Type.REFERENTIAL_INTEGRITY, String.format(
                "Both nodes must exist before adding edge %s -> %s, node %s is missing.",
                edge.fromNodeId, edge.toNodeId, missingNodeId));
    }

    public static RailwayNetworkException invalidDescription (String message) {
        return new RailwayNetworkException(Type.INVALID_DESCRIPTION, message);
    }

    public static RailwayNetworkException invalidDescription (String message, Throwable cause) {
        RailwayNetworkException exception = new RailwayNetworkException(Type.INVALID_DESCRIPTION, message);
        exception.initCause(cause);
        return exception;
    }

    public static RailwayNetworkException unknownNode (String nodeId) {
        return new RailwayNetworkException(Type.UNKNOWN_NODE, "Node " + nodeId + " is not in the network.");
    }

    public RailwayNetworkException (Type type, String message) {
        super(message);
        this.type = type;
    }

}
