package com.conveyal.cdl.network;

import com.google.common.base.Preconditions;

/**
 * A directed track segment between two nodes. There is at most one edge for each ordered pair of nodes.
 * Lengths are not validated: a negative length is stored as given.
 */
public class TrackEdge {

    public final String fromNodeId;
    public final String toNodeId;

    /** Length of the segment in meters. */
    public final double lengthMeters;

    /** Free text describing the segment. May be null. */
    public final String description;

    public TrackEdge (String fromNodeId, String toNodeId, double lengthMeters) {
        this(fromNodeId, toNodeId, lengthMeters, null);
    }

    public TrackEdge (String fromNodeId, String toNodeId, double lengthMeters, String description) {
        this.fromNodeId = Preconditions.checkNotNull(fromNodeId, "Edge origin must not be null");
        this.toNodeId = Preconditions.checkNotNull(toNodeId, "Edge destination must not be null");
        this.lengthMeters = lengthMeters;
        this.description = description;
    }

    @Override
    public String toString () {
        return String.format("%s -> %s (%.1fm)", fromNodeId, toNodeId, lengthMeters);
    }

}
