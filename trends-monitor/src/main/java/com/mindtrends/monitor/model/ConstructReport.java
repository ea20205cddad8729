package com.mindtrends.monitor.model;

import java.util.List;

/**
 * Everything one pipeline run produced for a single construct.
 *
 * @param impact null when no comparison period is configured or the baseline was insufficient
 * @param error  null unless reconciliation or detection failed for this construct
 */
public record ConstructReport(String construct,
                              ObservationSeries series,
                              List<AnomalyRecord> anomalies,
                              BaselineResult baseline,
                              List<ConsensusFlag> consensus,
                              PeriodImpact impact,
                              int chunksRequested,
                              int chunksFailed,
                              String error) {

    public boolean failed() {
        return error != null;
    }

    public long flaggedCount() {
        return anomalies.stream().filter(AnomalyRecord::flagged).count();
    }
}
