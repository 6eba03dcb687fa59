package com.conveyal.cdl.analysis;

import com.conveyal.cdl.network.ConflictZoneClassifier;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.TrackNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Places one protective signal on every approach to every conflict zone, a fixed sighting distance upstream of the
 * zone. Conflict zones are always reclassified first so placement never works from stale zones.
 *
 * Signal ids are derived from the approach and the zone, and an id that is already present in the network is never
 * recreated. Running the planner twice with the same network and distance therefore adds no signals the second time.
 *
 * An approach from which the zone cannot be reached within the search edge limit is skipped with a warning. The zone
 * is then protected on fewer approaches than its in-degree; callers that need full coverage must compare the two.
 */
public class SignalPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(SignalPlanner.class);

    public static final double DEFAULT_SIGNAL_DISTANCE_METERS = 500;

    private final RailwayNetwork network;

    private final BackwardPlacementSearch placementSearch;

    public SignalPlanner (RailwayNetwork network) {
        this(network, BackwardPlacementSearch.DEFAULT_MAX_PATH_EDGES);
    }

    public SignalPlanner (RailwayNetwork network, int maxPathEdges) {
        this.network = network;
        this.placementSearch = new BackwardPlacementSearch(network, maxPathEdges);
    }

    /** The id of the signal protecting the given zone on the given approach. */
    public static String signalId (String approachId, String zoneId) {
        return String.format("SIG_%s_%s", approachId, zoneId);
    }

    /**
     * @param signalDistance the sighting distance in meters, recorded on every signal created by this call.
     * @return the ids of the signals created by this call, grouped by zone in classification order and then by
     *         approach in edge insertion order.
     */
    public List<String> placeSignals (double signalDistance) {
        Preconditions.checkArgument(signalDistance > 0 && Double.isFinite(signalDistance),
                "Signal distance must be a positive number of meters, was %s", signalDistance);
        Set<String> zones = new ConflictZoneClassifier(network).identifyConflictZones();
        List<String> created = new ArrayList<>();
        int skipped = 0;
        for (String zoneId : zones) {
            for (String approachId : network.predecessors(zoneId)) {
                SignalPlacement placement = placementSearch.findBackwardPlacement(zoneId, approachId, signalDistance);
                if (placement == null) {
                    LOG.warn("Could not reach conflict zone {} from approach {} within {} edges, no signal placed.",
                            zoneId, approachId, placementSearch.maxPathEdges);
                    skipped++;
                    continue;
                }
                String signalId = signalId(approachId, zoneId);
                if (network.containsNode(signalId)) {
                    continue;
                }
                TrackNode placementNode = network.getNode(placement.placementNodeId);
                network.addNode(TrackNode.signal(signalId, placementNode, zoneId, approachId, signalDistance,
                        placement.offsetMeters));
                created.add(signalId);
                if (placement.approachTooShort) {
                    LOG.debug("Placed signal {} at start of {}m approach {}, shorter than {}m.", signalId,
                            placement.pathLengthMeters, approachId, signalDistance);
                } else {
                    LOG.debug("Placed signal {} at {} protecting conflict zone {}.", signalId, placement, zoneId);
                }
            }
        }
        LOG.info("Placed {} new signals {}m before {} conflict zones, {} approaches skipped.", created.size(),
                signalDistance, zones.size(), skipped);
        return created;
    }

}
