package com.conveyal.cdl;

import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.TrackEdge;
import com.conveyal.cdl.network.TrackNode;

import static com.conveyal.cdl.network.NodeRole.ENTRY_POINT;
import static com.conveyal.cdl.network.NodeRole.EXIT_POINT;
import static com.conveyal.cdl.network.NodeRole.PLATFORM;
import static com.conveyal.cdl.network.NodeRole.SWITCH;
import static com.conveyal.cdl.network.NodeRole.TRACK;

/** Small station layouts shared between tests. */
public abstract class StationFixtures {

    /** A → M ← B, M → EXIT. */
    public static RailwayNetwork simpleMerge () {
        RailwayNetwork network = new RailwayNetwork("Test: Simple Merge");
        node(network, "A", TRACK, 0, 100);
        node(network, "B", TRACK, 0, 0);
        node(network, "M", TRACK, 500, 50);
        node(network, "EXIT", EXIT_POINT, 1000, 50);
        edge(network, "A", "M", 550);
        edge(network, "B", "M", 550);
        edge(network, "M", "EXIT", 500);
        return network;
    }

    /** A → B → C → D, no merges. */
    public static RailwayNetwork linear () {
        RailwayNetwork network = new RailwayNetwork("Test: Linear");
        node(network, "A", ENTRY_POINT, 0, 0);
        node(network, "B", TRACK, 300, 0);
        node(network, "C", TRACK, 600, 0);
        node(network, "D", EXIT_POINT, 900, 0);
        edge(network, "A", "B", 300);
        edge(network, "B", "C", 300);
        edge(network, "C", "D", 300);
        return network;
    }

    /** ENTRY1 → M1 ← ENTRY2, M1 → M2 ← ENTRY3, M2 → EXIT. */
    public static RailwayNetwork chainedMerges () {
        RailwayNetwork network = new RailwayNetwork("Test: Multiple CDL");
        node(network, "ENTRY1", ENTRY_POINT, 0, 200);
        node(network, "ENTRY2", ENTRY_POINT, 0, 100);
        node(network, "ENTRY3", ENTRY_POINT, 0, 0);
        node(network, "M1", TRACK, 600, 150);
        node(network, "M2", TRACK, 1200, 100);
        node(network, "EXIT", EXIT_POINT, 1600, 100);
        edge(network, "ENTRY1", "M1", 650);
        edge(network, "ENTRY2", "M1", 550);
        edge(network, "M1", "M2", 650);
        edge(network, "ENTRY3", "M2", 1250);
        edge(network, "M2", "EXIT", 400);
        return network;
    }

    /** START → MID (300) → CDL (500), OTHER → CDL (850). */
    public static RailwayNetwork shortApproach () {
        RailwayNetwork network = new RailwayNetwork("Test: Signal Distance");
        node(network, "START", ENTRY_POINT, 0, 0);
        node(network, "MID", TRACK, 300, 0);
        node(network, "CDL", TRACK, 800, 0);
        node(network, "OTHER", TRACK, 0, 100);
        edge(network, "START", "MID", 300);
        edge(network, "MID", "CDL", 500);
        edge(network, "OTHER", "CDL", 850);
        return network;
    }

    /** T1 → SW ← T2, SW → EXIT, where the merge point is a switch. */
    public static RailwayNetwork convergingSwitch () {
        RailwayNetwork network = new RailwayNetwork("Test: Switches");
        node(network, "T1", TRACK, 0, 100);
        node(network, "T2", TRACK, 0, 0);
        node(network, "SW", SWITCH, 600, 50);
        node(network, "EXIT", EXIT_POINT, 1000, 50);
        edge(network, "T1", "SW", 650);
        edge(network, "T2", "SW", 650);
        edge(network, "SW", "EXIT", 400);
        return network;
    }

    /**
     * Two entries feeding two platforms, with a crossover from the A side to the B side, a siding, and three exits.
     * Tracks converge at SWITCH_B1 (from ENTRY_B and the crossover) and at EXIT_B (from both platform switches).
     */
    public static RailwayNetwork centralStation () {
        RailwayNetwork network = new RailwayNetwork("Central Station");
        network.addNode(new TrackNode("ENTRY_A", ENTRY_POINT, 0, 200, "Main entry from North"));
        network.addNode(new TrackNode("ENTRY_B", ENTRY_POINT, 0, 0, "Secondary entry from South"));
        node(network, "SWITCH_A1", SWITCH, 200, 200);
        node(network, "SWITCH_B1", SWITCH, 200, 0);
        node(network, "SWITCH_A2", SWITCH, 800, 200);
        node(network, "SWITCH_B2", SWITCH, 800, 0);
        node(network, "PLATFORM_1_START", PLATFORM, 400, 250);
        node(network, "PLATFORM_1_END", PLATFORM, 600, 250);
        node(network, "PLATFORM_2_START", PLATFORM, 400, 50);
        node(network, "PLATFORM_2_END", PLATFORM, 600, 50);
        network.addNode(new TrackNode("SIDING_MID", TRACK, 500, -100, "siding"));
        network.addNode(new TrackNode("EXIT_A", EXIT_POINT, 1000, 200, "Exit to East"));
        network.addNode(new TrackNode("EXIT_B", EXIT_POINT, 1000, 0, "Exit to Southeast"));
        network.addNode(new TrackNode("EXIT_C", EXIT_POINT, 900, -100, "Exit to Siding Yard"));

        edge(network, "ENTRY_A", "SWITCH_A1", 200);
        edge(network, "SWITCH_A1", "PLATFORM_1_START", 250);
        edge(network, "PLATFORM_1_START", "PLATFORM_1_END", 200);
        edge(network, "PLATFORM_1_END", "SWITCH_A2", 250);
        edge(network, "ENTRY_B", "SWITCH_B1", 200);
        edge(network, "SWITCH_B1", "PLATFORM_2_START", 250);
        edge(network, "PLATFORM_2_START", "PLATFORM_2_END", 200);
        edge(network, "PLATFORM_2_END", "SWITCH_B2", 250);
        edge(network, "SWITCH_A1", "SWITCH_B1", 200);
        edge(network, "SWITCH_B1", "SIDING_MID", 550);
        edge(network, "SIDING_MID", "EXIT_C", 450);
        edge(network, "SWITCH_A2", "EXIT_A", 200);
        edge(network, "SWITCH_B2", "EXIT_B", 200);
        edge(network, "SWITCH_A2", "EXIT_B", 300);
        return network;
    }

    public static void node (RailwayNetwork network, String id, NodeRole role, double x, double y) {
        network.addNode(new TrackNode(id, role, x, y));
    }

    public static void edge (RailwayNetwork network, String from, String to, double length) {
        network.addEdge(new TrackEdge(from, to, length));
    }

}
