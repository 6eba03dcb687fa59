package com.conveyal.cdl.io;

import com.conveyal.cdl.analysis.SignalPlanner;
import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.RailwayNetworkException;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StationDescriptionTest {

    @Test
    public void loadsNodesThenEdges () throws Exception {
        StationDescription description;
        try (InputStream stream = StationDescriptionTest.class.getResourceAsStream("simple-merge.json")) {
            description = StationDescription.fromJson(stream);
        }
        assertEquals(450, description.signalDistance.doubleValue());
        RailwayNetwork network = description.toNetwork();
        assertEquals("Simple Merge", network.name);
        assertEquals(4, network.getNodeCount());
        assertEquals(3, network.getEdgeCount());
        assertEquals(NodeRole.SWITCH, network.getNode("M").getRole());
        assertEquals("Converging turnout", network.getNode("M").description);
        assertEquals(NodeRole.EXIT_POINT, network.getNode("EXIT").getRole());
        assertEquals(Arrays.asList("A", "B"), network.predecessors("M"));

        assertEquals(Arrays.asList("SIG_A_M", "SIG_B_M"),
                new SignalPlanner(network).placeSignals(description.signalDistance));
        assertEquals(450, network.getNode("SIG_B_M").getDistanceToCdl());
    }

    @Test
    public void defaultsApply () {
        StationDescription description = StationDescription.fromJson("{nodes: [{id: 'X'}]}".replace('\'', '"'));
        assertEquals("Manual Station", description.name);
        assertNull(description.signalDistance);
        RailwayNetwork network = description.toNetwork();
        assertEquals(NodeRole.TRACK, network.getNode("X").getRole());
    }

    @Test
    public void danglingEdgeFails () {
        StationDescription description = StationDescription.fromJson(
                "{\"nodes\": [{\"id\": \"A\"}], \"edges\": [{\"from\": \"A\", \"to\": \"B\", \"length\": 10}]}");
        RailwayNetworkException e = assertThrows(RailwayNetworkException.class, description::toNetwork);
        assertEquals(RailwayNetworkException.Type.REFERENTIAL_INTEGRITY, e.type);
    }

    @Test
    public void unknownRoleFails () {
        StationDescription description = StationDescription.fromJson(
                "{\"nodes\": [{\"id\": \"A\", \"type\": \"tunnel\"}]}");
        RailwayNetworkException e = assertThrows(RailwayNetworkException.class, description::toNetwork);
        assertEquals(RailwayNetworkException.Type.INVALID_DESCRIPTION, e.type);
    }

    @Test
    public void misspelledFieldFails () {
        RailwayNetworkException e = assertThrows(RailwayNetworkException.class,
                () -> StationDescription.fromJson("{\"nodes\": [{\"id\": \"A\", \"kind\": \"track\"}]}"));
        assertEquals(RailwayNetworkException.Type.INVALID_DESCRIPTION, e.type);
        assertThrows(RailwayNetworkException.class, () -> StationDescription.fromJson("{not json"));
    }

}
