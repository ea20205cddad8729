package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A date that several detectors flagged for the same construct.
 */
public record ConsensusFlag(String construct, LocalDate date, double value, List<String> detectors) {

    public int agreement() {
        return detectors.size();
    }
}
