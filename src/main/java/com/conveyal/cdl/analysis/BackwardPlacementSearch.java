package com.conveyal.cdl.analysis;

import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.RailwayNetworkException;
import com.conveyal.cdl.network.TrackEdge;
import com.google.common.base.Preconditions;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the point a given distance upstream of a conflict zone along one of its approaches.
 *
 * All simple paths (no node visited twice) from the approach node to the zone are enumerated by depth-first search,
 * up to a maximum number of edges. The shortest of them is then walked backwards from the zone, accumulating track
 * length, until the requested distance falls inside an edge. The search is exhaustive within the edge limit, which is
 * the only protection against combinatorial explosion on large layouts: an approach whose every path to the zone is
 * longer than the limit gets no placement at all.
 *
 * The depth-first search uses explicit stacks rather than recursion, following successors in edge insertion order.
 * Paths are therefore enumerated in a deterministic order for a given network, and ties on length go to the path
 * found first.
 */
public class BackwardPlacementSearch {

    private static final Logger LOG = LoggerFactory.getLogger(BackwardPlacementSearch.class);

    public static final int DEFAULT_MAX_PATH_EDGES = 10;

    private final RailwayNetwork network;

    public final int maxPathEdges;

    public BackwardPlacementSearch (RailwayNetwork network) {
        this(network, DEFAULT_MAX_PATH_EDGES);
    }

    public BackwardPlacementSearch (RailwayNetwork network, int maxPathEdges) {
        Preconditions.checkArgument(maxPathEdges > 0, "Path edge limit must be positive, was %s", maxPathEdges);
        this.network = network;
        this.maxPathEdges = maxPathEdges;
    }

    /**
     * Sum the lengths of the edges between consecutive nodes of the path. A pair of nodes that is not connected by an
     * edge contributes nothing. Paths produced by this class always consist of real edges.
     */
    public double pathLength (List<String> path) {
        double total = 0;
        for (int i = 0; i < path.size() - 1; i++) {
            total += edgeLength(path.get(i), path.get(i + 1));
        }
        return total;
    }

    private double edgeLength (String fromNodeId, String toNodeId) {
        TrackEdge edge = network.getEdge(fromNodeId, toNodeId);
        return edge == null ? 0 : edge.lengthMeters;
    }

    /**
     * @return every path from one node to another that visits no node twice and has at most maxPathEdges edges,
     *         in depth-first order. Empty if the two nodes are the same or no such path exists.
     */
    public List<List<String>> simplePaths (String fromNodeId, String toNodeId) {
        List<List<String>> paths = new ArrayList<>();
        if (fromNodeId.equals(toNodeId)) {
            return paths;
        }
        // The current path, and for each node on it the successors and the position of the next one to explore.
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        List<List<String>> successorsStack = new ArrayList<>();
        TIntList nextSuccessorStack = new TIntArrayList();

        path.add(fromNodeId);
        onPath.add(fromNodeId);
        successorsStack.add(network.successors(fromNodeId));
        nextSuccessorStack.add(0);

        while (!successorsStack.isEmpty()) {
            int depth = successorsStack.size() - 1;
            List<String> successors = successorsStack.get(depth);
            int next = nextSuccessorStack.get(depth);
            if (next >= successors.size()) {
                // All successors of the last node on the path have been explored, backtrack.
                successorsStack.remove(depth);
                nextSuccessorStack.removeAt(depth);
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            nextSuccessorStack.set(depth, next + 1);
            String successor = successors.get(next);
            if (onPath.contains(successor)) {
                continue;
            }
            if (successor.equals(toNodeId)) {
                List<String> found = new ArrayList<>(path);
                found.add(successor);
                paths.add(found);
            } else if (path.size() < maxPathEdges) {
                // There is room for at least one more edge after this one.
                path.add(successor);
                onPath.add(successor);
                successorsStack.add(network.successors(successor));
                nextSuccessorStack.add(0);
            }
        }
        return paths;
    }

    /**
     * Find where the signal protecting the given zone on the given approach belongs.
     *
     * @param zoneId the conflict zone to protect.
     * @param approachId the node the approach starts from, usually a direct predecessor of the zone.
     * @param signalDistance the sighting distance in meters.
     * @return the placement, or null if the zone cannot be reached from the approach within the edge limit.
     * @throws RailwayNetworkException of type UNKNOWN_NODE if either node is not in the network.
     */
    public SignalPlacement findBackwardPlacement (String zoneId, String approachId, double signalDistance) {
        if (!network.containsNode(zoneId)) {
            throw RailwayNetworkException.unknownNode(zoneId);
        }
        if (!network.containsNode(approachId)) {
            throw RailwayNetworkException.unknownNode(approachId);
        }
        List<List<String>> paths = simplePaths(approachId, zoneId);
        if (paths.isEmpty()) {
            LOG.debug("No path from {} to {} within {} edges.", approachId, zoneId, maxPathEdges);
            return null;
        }
        List<String> shortest = null;
        double shortestLength = Double.POSITIVE_INFINITY;
        for (List<String> candidate : paths) {
            double length = pathLength(candidate);
            // Strictly less than, so the first path enumerated wins ties.
            if (shortest == null || length < shortestLength) {
                shortest = candidate;
                shortestLength = length;
            }
        }

        double accumulated = 0;
        for (int i = shortest.size() - 1; i > 0; i--) {
            String previous = shortest.get(i - 1);
            double segmentLength = edgeLength(previous, shortest.get(i));
            if (accumulated + segmentLength >= signalDistance) {
                return new SignalPlacement(previous, signalDistance - accumulated, shortest, shortestLength, false);
            }
            accumulated += segmentLength;
        }
        // The approach is shorter than the sighting distance. Go as far back as the track allows.
        return new SignalPlacement(shortest.get(0), 0, shortest, shortestLength, true);
    }

}
