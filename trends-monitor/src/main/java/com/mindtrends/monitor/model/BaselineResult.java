package com.mindtrends.monitor.model;

import java.util.Optional;

/**
 * Result of a baseline comparison. Either carries statistics, or states that the
 * baseline range was not covered well enough to produce any.
 */
public record BaselineResult(String construct,
                             DateRange range,
                             BaselineStatistics statistics,
                             double coverage,
                             String reason) {

    public static BaselineResult of(BaselineStatistics statistics) {
        return new BaselineResult(statistics.construct(), statistics.range(), statistics,
                statistics.coverage(), null);
    }

    public static BaselineResult insufficient(String construct, DateRange range, double coverage, String reason) {
        return new BaselineResult(construct, range, null, coverage, reason);
    }

    public boolean sufficient() {
        return statistics != null;
    }

    public Optional<BaselineStatistics> statisticsIfSufficient() {
        return Optional.ofNullable(statistics);
    }
}
