package com.moveatlas.engine.discovery;

import com.moveatlas.engine.config.AnalysisConfig;
import com.moveatlas.engine.source.ObjectPageSource.CountEstimate;

/**
 * How many instances of one key type to materialize. First matching rule wins:
 * critical types are fetched up to the hard cap, small fully-counted populations are
 * fetched whole, everything else is sampled (or capped at the threshold when sampling is off).
 */
public record FetchStrategy(Mode mode, int limit, String reason) {

    public enum Mode { ALL, SAMPLE }

    public static FetchStrategy select(boolean critical, CountEstimate estimate, AnalysisConfig config) {
        if (critical) {
            return new FetchStrategy(Mode.ALL, config.getHardCapCritical(), "critical type");
        }
        int threshold = config.getTypeCountThreshold();
        if (estimate.estimatedCount() <= threshold && !estimate.hasMore()) {
            return new FetchStrategy(Mode.ALL, threshold, "population within threshold");
        }
        if (config.isSampleLargeTypes()) {
            return new FetchStrategy(Mode.SAMPLE, config.getObjectSampleSize(), "large population, sampling");
        }
        return new FetchStrategy(Mode.ALL, threshold, "large population, sampling disabled");
    }
}
