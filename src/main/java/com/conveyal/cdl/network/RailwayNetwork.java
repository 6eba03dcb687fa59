package com.conveyal.cdl.network;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TLongIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A station track layout as a directed graph. This owns all nodes and edges of one analysis run.
 *
 * Each node is assigned a dense vertex index in the order it was first added, and each distinct (from, to) pair is
 * assigned a dense edge index. Adjacency is kept as one list of edge indices per vertex in each direction, so
 * predecessor and successor queries return nodes in edge insertion order. Nothing is ever removed from the network.
 *
 * The conflict zone and signal id sets are caches for reporting. They are extended when nodes with those roles are
 * added and when the {@link ConflictZoneClassifier} reclassifies nodes. They are never shrunk, so after a node is
 * overwritten with a different role they may name ids that no longer have that role.
 *
 * Not threadsafe: one analysis run owns a network exclusively.
 */
public class RailwayNetwork {

    private static final Logger LOG = LoggerFactory.getLogger(RailwayNetwork.class);

    public final String name;

    /** Nodes indexed by vertex index. */
    private final List<TrackNode> nodes = new ArrayList<>();

    private final TObjectIntMap<String> vertexIndexForNodeId = new TObjectIntHashMap<>(64, 0.5f, -1);

    /** Edges indexed by edge index. */
    private final List<TrackEdge> edges = new ArrayList<>();

    /** Edge index keyed on the from and to vertex indexes packed into a single long, see {@link #pairKey(int, int)}. */
    private final TLongIntMap edgeIndexForVertexPair = new TLongIntHashMap(64, 0.5f, -1, -1);

    /** For each vertex, the indexes of edges leaving it, in insertion order. */
    private final List<TIntList> outgoingEdges = new ArrayList<>();

    /** For each vertex, the indexes of edges arriving at it, in insertion order. */
    private final List<TIntList> incomingEdges = new ArrayList<>();

    private final Set<String> conflictZoneIds = new LinkedHashSet<>();

    private final Set<String> signalIds = new LinkedHashSet<>();

    public RailwayNetwork () {
        this("Railway Station");
    }

    public RailwayNetwork (String name) {
        this.name = name;
    }

    /**
     * Add a node, or replace the node that already has the same id. A replaced node keeps its vertex index and
     * therefore all edges touching it, but none of the data held on the previous node object.
     */
    public void addNode (TrackNode node) {
        int vertex = vertexIndexForNodeId.get(node.id);
        if (vertex < 0) {
            vertex = nodes.size();
            nodes.add(node);
            outgoingEdges.add(new TIntArrayList(4));
            incomingEdges.add(new TIntArrayList(4));
            vertexIndexForNodeId.put(node.id, vertex);
        } else {
            LOG.debug("Replacing existing node {}.", node.id);
            nodes.set(vertex, node);
        }
        if (node.getRole() == NodeRole.SIGNAL) {
            signalIds.add(node.id);
        } else if (node.getRole() == NodeRole.CONFLICT_ZONE) {
            conflictZoneIds.add(node.id);
        }
    }

    /**
     * Add a directed edge, or replace the existing edge between the same ordered pair of nodes.
     * @throws RailwayNetworkException of type REFERENTIAL_INTEGRITY if either endpoint is not already in the network.
     *         In that case the network is left unchanged.
     */
    public void addEdge (TrackEdge edge) {
        int fromVertex = vertexIndexForNodeId.get(edge.fromNodeId);
        if (fromVertex < 0) {
            throw RailwayNetworkException.referentialIntegrity(edge, edge.fromNodeId);
        }
        int toVertex = vertexIndexForNodeId.get(edge.toNodeId);
        if (toVertex < 0) {
            throw RailwayNetworkException.referentialIntegrity(edge, edge.toNodeId);
        }
        long key = pairKey(fromVertex, toVertex);
        int edgeIndex = edgeIndexForVertexPair.get(key);
        if (edgeIndex < 0) {
            edgeIndex = edges.size();
            edges.add(edge);
            edgeIndexForVertexPair.put(key, edgeIndex);
            outgoingEdges.get(fromVertex).add(edgeIndex);
            incomingEdges.get(toVertex).add(edgeIndex);
        } else {
            LOG.debug("Replacing existing edge {} -> {}.", edge.fromNodeId, edge.toNodeId);
            edges.set(edgeIndex, edge);
        }
    }

    /** Pack two vertex indexes into a single long key. */
    private static long pairKey (int fromVertex, int toVertex) {
        return ((long) fromVertex << 32) | (toVertex & 0xFFFFFFFFL);
    }

    /** @return the ids of all nodes with an edge ending at the given node, in edge insertion order. */
    public List<String> predecessors (String nodeId) {
        int vertex = vertexIndexForNodeId.get(nodeId);
        if (vertex < 0) {
            return Collections.emptyList();
        }
        TIntList incoming = incomingEdges.get(vertex);
        List<String> result = new ArrayList<>(incoming.size());
        for (int i = 0; i < incoming.size(); i++) {
            result.add(edges.get(incoming.get(i)).fromNodeId);
        }
        return result;
    }

    /** @return the ids of all nodes reached by an edge leaving the given node, in edge insertion order. */
    public List<String> successors (String nodeId) {
        int vertex = vertexIndexForNodeId.get(nodeId);
        if (vertex < 0) {
            return Collections.emptyList();
        }
        TIntList outgoing = outgoingEdges.get(vertex);
        List<String> result = new ArrayList<>(outgoing.size());
        for (int i = 0; i < outgoing.size(); i++) {
            result.add(edges.get(outgoing.get(i)).toNodeId);
        }
        return result;
    }

    /** @return the number of distinct nodes with an edge ending at the given node, zero for unknown nodes. */
    public int inDegree (String nodeId) {
        int vertex = vertexIndexForNodeId.get(nodeId);
        return vertex < 0 ? 0 : incomingEdges.get(vertex).size();
    }

    public boolean containsNode (String nodeId) {
        return vertexIndexForNodeId.containsKey(nodeId);
    }

    /** @return the node with the given id, or null if there is no such node. */
    public TrackNode getNode (String nodeId) {
        int vertex = vertexIndexForNodeId.get(nodeId);
        return vertex < 0 ? null : nodes.get(vertex);
    }

    /** @return the edge from one node to another, or null if the two are not directly connected in that direction. */
    public TrackEdge getEdge (String fromNodeId, String toNodeId) {
        int fromVertex = vertexIndexForNodeId.get(fromNodeId);
        int toVertex = vertexIndexForNodeId.get(toNodeId);
        if (fromVertex < 0 || toVertex < 0) {
            return null;
        }
        int edgeIndex = edgeIndexForVertexPair.get(pairKey(fromVertex, toVertex));
        return edgeIndex < 0 ? null : edges.get(edgeIndex);
    }

    /** @return all nodes in the order they were first added. */
    public List<TrackNode> nodes () {
        return Collections.unmodifiableList(nodes);
    }

    /** @return all edges in the order they were first added. */
    public List<TrackEdge> edges () {
        return Collections.unmodifiableList(edges);
    }

    public int getNodeCount () {
        return nodes.size();
    }

    public int getEdgeCount () {
        return edges.size();
    }

    /** @return every id ever recorded as a conflict zone, in the order they were recorded. */
    public Set<String> conflictZoneIds () {
        return Collections.unmodifiableSet(conflictZoneIds);
    }

    /** @return every id ever added with the signal role, in the order they were added. */
    public Set<String> signalIds () {
        return Collections.unmodifiableSet(signalIds);
    }

    void registerConflictZone (String nodeId) {
        conflictZoneIds.add(nodeId);
    }

    @Override
    public String toString () {
        return String.format("%s (%d nodes, %d edges)", name, nodes.size(), edges.size());
    }

}
