package com.conveyal.cdl.analysis;

import com.conveyal.cdl.network.ConflictZoneClassifier;
import com.conveyal.cdl.network.RailwayNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * One complete analysis run over a station network: classify conflict zones, place protective signals, and gather
 * the results into a report.
 */
public class StationAnalysis {

    private static final Logger LOG = LoggerFactory.getLogger(StationAnalysis.class);

    /** Parameters of an analysis run. */
    public interface Config {
        /** Meters upstream of each conflict zone at which signals are placed. */
        double signalDistance ();
        /** Longest path in edges searched between an approach and its zone. */
        int maxPathEdges ();
    }

    public static AnalysisReport run (RailwayNetwork network, Config config) {
        long startTime = System.currentTimeMillis();
        Set<String> zones = new ConflictZoneClassifier(network).identifyConflictZones();
        List<String> newSignals = new SignalPlanner(network, config.maxPathEdges())
                .placeSignals(config.signalDistance());
        AnalysisReport report = new AnalysisReport(network, zones, newSignals, config.signalDistance());
        if (report.uncoveredApproaches > 0) {
            LOG.warn("{} approaches to conflict zones in {} are not protected by a signal.",
                    report.uncoveredApproaches, network.name);
        }
        LOG.info("Analysis of {} finished in {} msec.", network.name, System.currentTimeMillis() - startTime);
        return report;
    }

}
