package com.conveyal.cdl.analysis;

import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.TrackEdge;
import com.conveyal.cdl.network.TrackNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Aggregate counts over the current contents of a network. Computing them never modifies the network. */
@JsonPropertyOrder({"total_nodes", "total_edges", "tracks", "switches", "signals", "cdl_zones", "platforms",
        "total_track_length"})
public class NetworkStatistics {

    @JsonProperty("total_nodes")
    public final int totalNodes;

    @JsonProperty("total_edges")
    public final int totalEdges;

    @JsonProperty("total_track_length")
    public final double totalTrackLengthMeters;

    /** Size of the network's conflict zone cache. */
    @JsonProperty("cdl_zones")
    public final int conflictZones;

    /** Size of the network's signal cache. */
    @JsonProperty("signals")
    public final int signals;

    @JsonIgnore
    private final Map<NodeRole, Integer> nodesByRole;

    private NetworkStatistics (RailwayNetwork network) {
        totalNodes = network.getNodeCount();
        totalEdges = network.getEdgeCount();
        double length = 0;
        for (TrackEdge edge : network.edges()) {
            length += edge.lengthMeters;
        }
        totalTrackLengthMeters = length;
        conflictZones = network.conflictZoneIds().size();
        signals = network.signalIds().size();
        Map<NodeRole, Integer> counts = new EnumMap<>(NodeRole.class);
        for (NodeRole role : NodeRole.values()) {
            counts.put(role, 0);
        }
        for (TrackNode node : network.nodes()) {
            counts.merge(node.getRole(), 1, Integer::sum);
        }
        nodesByRole = Collections.unmodifiableMap(counts);
    }

    public static NetworkStatistics of (RailwayNetwork network) {
        return new NetworkStatistics(network);
    }

    /** @return the number of nodes currently having the given role. */
    public int count (NodeRole role) {
        return nodesByRole.get(role);
    }

    @JsonProperty("tracks")
    public int getTracks () {
        return count(NodeRole.TRACK);
    }

    @JsonProperty("switches")
    public int getSwitches () {
        return count(NodeRole.SWITCH);
    }

    @JsonProperty("platforms")
    public int getPlatforms () {
        return count(NodeRole.PLATFORM);
    }

}
