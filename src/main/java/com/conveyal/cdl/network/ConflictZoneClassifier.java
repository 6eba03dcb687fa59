package com.conveyal.cdl.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds conflict (CDL) zones: nodes where two or more tracks converge, and where trains arriving on different
 * approaches could therefore collide. Every node with an in-degree of at least two is a conflict zone.
 *
 * Nodes that are not yet conflict zones are rewritten to that role and given a snapshot of their incoming tracks.
 * Nodes that already have the role are left untouched, so their snapshot reflects the graph as it was when they were
 * first classified, not any edges added since. Running the classifier again on an unchanged network returns the same
 * set and changes nothing.
 */
public class ConflictZoneClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ConflictZoneClassifier.class);

    public static final int MIN_CONVERGING_TRACKS = 2;

    private final RailwayNetwork network;

    public ConflictZoneClassifier (RailwayNetwork network) {
        this.network = network;
    }

    /**
     * Single pass over all nodes in insertion order.
     * @return the ids of all conflict zones as of this pass, in node insertion order.
     */
    public Set<String> identifyConflictZones () {
        Set<String> zones = new LinkedHashSet<>();
        int reclassified = 0;
        for (TrackNode node : network.nodes()) {
            if (network.inDegree(node.id) < MIN_CONVERGING_TRACKS) {
                continue;
            }
            if (node.markConflictZone(network.predecessors(node.id))) {
                LOG.debug("Node {} is a conflict zone, incoming tracks {}.", node.id, node.getIncomingTracks());
                reclassified++;
            }
            zones.add(node.id);
            network.registerConflictZone(node.id);
        }
        LOG.info("Identified {} conflict zones in {} ({} newly classified).", zones.size(), network.name, reclassified);
        return zones;
    }

}
