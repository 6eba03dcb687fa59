package com.conveyal.cdl.analysis;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Where a protective signal belongs on one approach to a conflict zone: on the track leaving the placement node,
 * offsetMeters along it towards the zone. An offset of zero means the signal sits on the placement node itself.
 */
public class SignalPlacement {

    public final String placementNodeId;

    public final double offsetMeters;

    /** The shortest path from the approach node to the zone that the placement was measured along. */
    public final List<String> path;

    public final double pathLengthMeters;

    /**
     * True if the path was shorter than the requested sighting distance, in which case the signal was placed on the
     * path origin with zero offset, as far back as the track allows.
     */
    public final boolean approachTooShort;

    public SignalPlacement (String placementNodeId, double offsetMeters, List<String> path, double pathLengthMeters,
                            boolean approachTooShort) {
        this.placementNodeId = placementNodeId;
        this.offsetMeters = offsetMeters;
        this.path = ImmutableList.copyOf(path);
        this.pathLengthMeters = pathLengthMeters;
        this.approachTooShort = approachTooShort;
    }

    @Override
    public String toString () {
        return String.format("%s + %.1fm along %s", placementNodeId, offsetMeters, path);
    }

}
