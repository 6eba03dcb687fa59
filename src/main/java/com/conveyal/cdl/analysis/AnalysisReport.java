package com.conveyal.cdl.analysis;

import com.conveyal.cdl.network.RailwayNetwork;
import com.conveyal.cdl.network.TrackNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The results of a {@link StationAnalysis} run, shaped for serialization to JSON.
 * Signals and zones are described as they are in the network when the report is built.
 */
public class AnalysisReport {

    public final String station;

    @JsonProperty("signal_distance")
    public final double signalDistance;

    public final NetworkStatistics stats;

    @JsonProperty("cdl_zones")
    public final List<ZoneDetail> conflictZones;

    /** All signals in the network, including those that existed before this run. */
    public final List<SignalDetail> signals;

    /** Ids of the signals created by this run. */
    @JsonProperty("new_signals")
    public final List<String> newSignals;

    /** Sum over all zones of approaches that have no protecting signal. */
    @JsonProperty("uncovered_approaches")
    public final int uncoveredApproaches;

    public AnalysisReport (RailwayNetwork network, Set<String> zones, List<String> newSignals, double signalDistance) {
        this.station = network.name;
        this.signalDistance = signalDistance;
        this.stats = NetworkStatistics.of(network);
        this.newSignals = ImmutableList.copyOf(newSignals);

        List<SignalDetail> signalDetails = new ArrayList<>();
        for (String signalId : network.signalIds()) {
            TrackNode signal = network.getNode(signalId);
            if (signal != null && signal.getProtectedZoneId() != null) {
                signalDetails.add(new SignalDetail(signal));
            }
        }
        this.signals = signalDetails;

        List<ZoneDetail> zoneDetails = new ArrayList<>();
        int uncovered = 0;
        for (String zoneId : zones) {
            ZoneDetail detail = new ZoneDetail(network, zoneId, signalDetails);
            uncovered += detail.incomingTracks.size() - detail.protectingSignals.size();
            zoneDetails.add(detail);
        }
        this.conflictZones = zoneDetails;
        this.uncoveredApproaches = uncovered;
    }

    public static class ZoneDetail {

        public final String id;

        /** Current predecessors of the zone, one per approach. */
        @JsonProperty("incoming_tracks")
        public final List<String> incomingTracks;

        @JsonProperty("protecting_signals")
        public final List<String> protectingSignals;

        ZoneDetail (RailwayNetwork network, String zoneId, List<SignalDetail> signals) {
            this.id = zoneId;
            this.incomingTracks = network.predecessors(zoneId);
            List<String> protecting = new ArrayList<>();
            for (SignalDetail signal : signals) {
                if (zoneId.equals(signal.protectsCdlZone)) {
                    protecting.add(signal.id);
                }
            }
            this.protectingSignals = protecting;
        }
    }

    public static class SignalDetail {

        public final String id;

        @JsonProperty("protects_cdl_zone")
        public final String protectsCdlZone;

        @JsonProperty("approach_from")
        public final String approachFrom;

        @JsonProperty("placement_node")
        public final String placementNode;

        @JsonProperty("distance_to_cdl")
        public final double distanceToCdl;

        @JsonProperty("offset_from_placement")
        public final double offsetFromPlacement;

        SignalDetail (TrackNode signal) {
            this.id = signal.id;
            this.protectsCdlZone = signal.getProtectedZoneId();
            this.approachFrom = signal.getApproachId();
            this.placementNode = signal.getPlacementNodeId();
            this.distanceToCdl = signal.getDistanceToCdl();
            this.offsetFromPlacement = signal.getOffsetFromPlacement();
        }
    }

}
