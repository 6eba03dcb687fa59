package com.conveyal.cdl.config;

import com.conveyal.cdl.analysis.StationAnalysis;

import java.util.Properties;

/** Loads the parameters of a station analysis run and exposes them through {@link StationAnalysis.Config}. */
public class AnalysisConfig extends ConfigBase implements StationAnalysis.Config {

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULT_RESOURCE = "analysis.properties";

    private final double signalDistance;
    private final int maxPathEdges;

    public AnalysisConfig (Properties properties) {
        super(properties);
        signalDistance = doubleProp("signal-distance");
        if (!keysWithErrors.contains("signal-distance") && !(signalDistance > 0 && Double.isFinite(signalDistance))) {
            invalid("signal-distance", signalDistance, "must be a positive number of meters");
        }
        maxPathEdges = intProp("max-path-edges");
        if (!keysWithErrors.contains("max-path-edges") && maxPathEdges < 1) {
            invalid("max-path-edges", maxPathEdges, "must be at least 1");
        }
        throwIfErrors();
    }

    /** The shipped defaults, with any environment or system property overrides applied. */
    public static AnalysisConfig fromClasspath () {
        return new AnalysisConfig(propsFromResource(DEFAULT_RESOURCE));
    }

    public static AnalysisConfig fromFile (String filename) {
        return new AnalysisConfig(propsFromFile(filename));
    }

    @Override public double signalDistance () { return signalDistance; }
    @Override public int    maxPathEdges ()   { return maxPathEdges; }

}
