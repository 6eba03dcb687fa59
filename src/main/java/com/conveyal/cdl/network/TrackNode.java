package com.conveyal.cdl.network;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A point in a station track layout: a plain piece of track, a switch, a platform end, an entry or exit of the
 * station, or a protective signal placed by the {@link com.conveyal.cdl.analysis.SignalPlanner}.
 *
 * The position is carried through for drawing the layout and plays no part in the analysis.
 *
 * Instead of a free-form attribute map, the data that is only meaningful for some roles is held in explicit fields
 * that are null (or NaN) for the other roles: the incoming track snapshot for conflict zones, and the protection
 * details for signals.
 */
public class TrackNode {

    public final String id;

    /** Mutable only through {@link #markConflictZone(List)}. */
    private NodeRole role;

    /** Position in meters, in an arbitrary station-local coordinate system. */
    public final double x;
    public final double y;

    /** Free text, e.g. "Main entry from North". May be null. */
    public final String description;

    /** For conflict zones, the predecessors at the moment the node was first classified. Otherwise null. */
    private List<String> incomingTracks;

    // Signal protection details, only set on nodes created by the signal planner.
    private final String protectedZoneId;
    private final String approachId;
    private final String placementNodeId;
    private final double distanceToCdl;
    private final double offsetFromPlacement;

    public TrackNode (String id, NodeRole role, double x, double y) {
        this(id, role, x, y, null);
    }

    public TrackNode (String id, NodeRole role, double x, double y, String description) {
        this(id, role, x, y, description, null, null, null, Double.NaN, Double.NaN);
    }

    private TrackNode (String id, NodeRole role, double x, double y, String description, String protectedZoneId,
                       String approachId, String placementNodeId, double distanceToCdl, double offsetFromPlacement) {
        Preconditions.checkNotNull(id, "Node id must not be null");
        Preconditions.checkNotNull(role, "Node role must not be null for node %s", id);
        this.id = id;
        this.role = role;
        this.x = x;
        this.y = y;
        this.description = description;
        this.protectedZoneId = protectedZoneId;
        this.approachId = approachId;
        this.placementNodeId = placementNodeId;
        this.distanceToCdl = distanceToCdl;
        this.offsetFromPlacement = offsetFromPlacement;
    }

    /**
     * Create a signal protecting the given conflict zone on one of its approaches. The signal sits at the position of
     * the placement node; the physical signal is offsetFromPlacement meters further along the track towards the zone.
     *
     * @param distanceToCdl the sighting distance that was requested, not the distance that could actually be achieved.
     */
    public static TrackNode signal (String id, TrackNode placementNode, String protectedZoneId, String approachId,
                                    double distanceToCdl, double offsetFromPlacement) {
        return new TrackNode(id, NodeRole.SIGNAL, placementNode.x, placementNode.y, null, protectedZoneId,
                approachId, placementNode.id, distanceToCdl, offsetFromPlacement);
    }

    public NodeRole getRole () {
        return role;
    }

    /**
     * Transition this node to the conflict zone role, recording a snapshot of its incoming tracks.
     * Calling this on a node that is already a conflict zone has no effect, in particular the snapshot is not refreshed.
     * Only the {@link ConflictZoneClassifier} performs this transition.
     *
     * @return true if the role was changed.
     */
    boolean markConflictZone (List<String> predecessors) {
        if (role == NodeRole.CONFLICT_ZONE) {
            return false;
        }
        role = NodeRole.CONFLICT_ZONE;
        incomingTracks = ImmutableList.copyOf(predecessors);
        return true;
    }

    /** @return the incoming tracks recorded at classification time, or null if this node was never classified. */
    public List<String> getIncomingTracks () {
        return incomingTracks;
    }

    /** @return the id of the conflict zone this signal protects, or null if this is not a placed signal. */
    public String getProtectedZoneId () {
        return protectedZoneId;
    }

    /** @return the direct predecessor of the protected zone whose path this signal covers. */
    public String getApproachId () {
        return approachId;
    }

    /** @return the node the signal was placed relative to. */
    public String getPlacementNodeId () {
        return placementNodeId;
    }

    /** @return the requested sighting distance in meters, NaN for nodes that are not placed signals. */
    public double getDistanceToCdl () {
        return distanceToCdl;
    }

    /** @return meters from the placement node towards the zone, NaN for nodes that are not placed signals. */
    public double getOffsetFromPlacement () {
        return offsetFromPlacement;
    }

    @Override
    public String toString () {
        return String.format("%s (%s) at (%.1f, %.1f)", id, role.wireName, x, y);
    }

}
