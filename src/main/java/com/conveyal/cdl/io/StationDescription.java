package com.conveyal.cdl.io;

import com.conveyal.cdl.common.JsonUtilities;
import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.RailwayNetworkException;
import com.conveyal.cdl.network.TrackEdge;
import com.conveyal.cdl.network.TrackNode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A station layout as a JSON document, e.g.
 * <pre>
 * { "name": "Test", "signal_distance": 500,
 *   "nodes": [ {"id": "A", "type": "track", "x": 0, "y": 100}, ... ],
 *   "edges": [ {"from": "A", "to": "M", "length": 550}, ... ] }
 * </pre>
 * Node types are role wire names such as "entry", "switch" or "cdl_zone".
 * Fields are public so Jackson can bind them directly. Unknown fields are rejected.
 */
public class StationDescription {

    public String name = "Manual Station";

    /** Requested sighting distance in meters, or null to use the configured one. */
    @JsonProperty("signal_distance")
    public Double signalDistance;

    public List<NodeDescription> nodes = new ArrayList<>();

    public List<EdgeDescription> edges = new ArrayList<>();

    public static class NodeDescription {
        public String id;
        public String type = NodeRole.TRACK.wireName;
        public double x;
        public double y;
        public String description;
    }

    public static class EdgeDescription {
        public String from;
        public String to;
        public double length;
        public String description;
    }

    public static StationDescription fromJson (InputStream inputStream) {
        try {
            return JsonUtilities.objectMapper.readValue(inputStream, StationDescription.class);
        } catch (IOException e) {
            throw RailwayNetworkException.invalidDescription("Could not parse station description: " + e.getMessage(), e);
        }
    }

    public static StationDescription fromJson (String json) {
        try {
            return JsonUtilities.objectMapper.readValue(json, StationDescription.class);
        } catch (IOException e) {
            throw RailwayNetworkException.invalidDescription("Could not parse station description: " + e.getMessage(), e);
        }
    }

    /**
     * Build a network holding all the described nodes, then all the described edges.
     * @throws RailwayNetworkException if a node has no id or an unknown type, or an edge refers to a missing node.
     */
    public RailwayNetwork toNetwork () {
        RailwayNetwork network = new RailwayNetwork(name);
        for (NodeDescription node : nodes) {
            if (node.id == null) {
                throw RailwayNetworkException.invalidDescription("Node without an id in station " + name);
            }
            NodeRole role = NodeRole.forName(node.type);
            if (role == null) {
                throw RailwayNetworkException.invalidDescription(
                        String.format("Node %s has unknown type '%s'.", node.id, node.type));
            }
            network.addNode(new TrackNode(node.id, role, node.x, node.y, node.description));
        }
        for (EdgeDescription edge : edges) {
            if (edge.from == null || edge.to == null) {
                throw RailwayNetworkException.invalidDescription("Edge without both endpoints in station " + name);
            }
            network.addEdge(new TrackEdge(edge.from, edge.to, edge.length, edge.description));
        }
        return network;
    }

}
