package com.conveyal.cdl.io;

import com.conveyal.cdl.analysis.NetworkStatistics;
import com.conveyal.cdl.network.NodeRole;
import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.TrackNode;
import com.google.common.base.Strings;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/** Renders a plain text summary of a station network: statistics, conflict zones and signals, sorted by id. */
public abstract class NetworkSummary {

    private static final String RULE = Strings.repeat("=", 70);

    public static String of (RailwayNetwork network) {
        NetworkStatistics stats = NetworkStatistics.of(network);
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("RAILWAY NETWORK SUMMARY: ").append(network.name).append('\n');
        sb.append(RULE).append("\n\n");

        sb.append("NETWORK STATISTICS:\n");
        line(sb, "Total Nodes", stats.totalNodes);
        line(sb, "Total Edges", stats.totalEdges);
        line(sb, "Track Nodes", stats.count(NodeRole.TRACK));
        line(sb, "Switches", stats.count(NodeRole.SWITCH));
        line(sb, "Signals", stats.signals);
        line(sb, "CDL Zones", stats.conflictZones);
        line(sb, "Platforms", stats.count(NodeRole.PLATFORM));
        sb.append(String.format(Locale.ROOT, "  - Total Track Length: %.2f meters\n", stats.totalTrackLengthMeters));

        sb.append("\nCDL ZONES (Conflict/Merge Points):\n");
        for (String zoneId : sorted(network.conflictZoneIds())) {
            sb.append("  - ").append(zoneId).append('\n');
            sb.append("    - Incoming tracks: ").append(String.join(", ", network.predecessors(zoneId))).append('\n');
        }

        sb.append("\nSIGNALS:\n");
        for (String signalId : sorted(network.signalIds())) {
            sb.append("  - ").append(signalId).append('\n');
            TrackNode signal = network.getNode(signalId);
            if (signal != null && signal.getProtectedZoneId() != null) {
                sb.append("    - Protects CDL Zone: ").append(signal.getProtectedZoneId()).append('\n');
                sb.append("    - Approach from: ").append(signal.getApproachId()).append('\n');
                sb.append(String.format(Locale.ROOT, "    - Distance to CDL: %.1fm\n", signal.getDistanceToCdl()));
            }
        }
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    private static void line (StringBuilder sb, String label, int value) {
        sb.append("  - ").append(label).append(": ").append(value).append('\n');
    }

    private static Set<String> sorted (Set<String> ids) {
        return new TreeSet<>(ids);
    }

}
