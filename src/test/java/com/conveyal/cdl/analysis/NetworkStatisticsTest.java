package com.conveyal.cdl.analysis;

import com.conveyal.cdl.StationFixtures;
import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NetworkStatisticsTest {

    @Test
    public void emptyNetwork () {
        NetworkStatistics stats = NetworkStatistics.of(new RailwayNetwork());
        assertEquals(0, stats.totalNodes);
        assertEquals(0, stats.totalEdges);
        assertEquals(0, stats.totalTrackLengthMeters);
        for (NodeRole role : NodeRole.values()) {
            assertEquals(0, stats.count(role));
        }
    }

    @Test
    public void countsBeforeAndAfterPlacement () {
        RailwayNetwork network = StationFixtures.centralStation();
        NetworkStatistics before = NetworkStatistics.of(network);
        assertEquals(14, before.totalNodes);
        assertEquals(14, before.totalEdges);
        assertEquals(3700, before.totalTrackLengthMeters);
        assertEquals(4, before.getSwitches());
        assertEquals(4, before.getPlatforms());
        assertEquals(1, before.getTracks());
        assertEquals(2, before.count(NodeRole.ENTRY_POINT));
        assertEquals(3, before.count(NodeRole.EXIT_POINT));
        assertEquals(0, before.conflictZones);
        assertEquals(0, before.signals);

        new SignalPlanner(network).placeSignals(500);
        NetworkStatistics after = NetworkStatistics.of(network);
        assertEquals(18, after.totalNodes);
        assertEquals(14, after.totalEdges);
        assertEquals(3, after.getSwitches());
        assertEquals(2, after.count(NodeRole.EXIT_POINT));
        assertEquals(2, after.count(NodeRole.CONFLICT_ZONE));
        assertEquals(4, after.count(NodeRole.SIGNAL));
        assertEquals(2, after.conflictZones);
        assertEquals(4, after.signals);
        // Computing statistics leaves the network alone
        assertEquals(18, network.getNodeCount());
    }

}
