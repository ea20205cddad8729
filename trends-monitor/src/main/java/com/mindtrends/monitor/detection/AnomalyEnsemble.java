package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineStatistics;
import com.mindtrends.monitor.model.ObservationSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every detector over a series and returns all of their records side by side.
 *
 * Records are not merged: one date can carry a record from each detector, so consumers
 * can tell which methods agree. A detector that fails contributes nothing and the
 * others still run.
 */
@Slf4j
@Component
public class AnomalyEnsemble {

    private final List<AnomalyDetector> detectors;

    public AnomalyEnsemble(List<AnomalyDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public List<String> detectorNames() {
        return detectors.stream().map(AnomalyDetector::name).toList();
    }

    public List<AnomalyRecord> detect(ObservationSeries series) {
        return detect(series, null);
    }

    /**
     * @return records grouped by detector in registration order, each group in date order
     */
    public List<AnomalyRecord> detect(ObservationSeries series, BaselineStatistics baseline) {
        List<AnomalyRecord> records = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                List<AnomalyRecord> produced = detector.evaluate(series, baseline);
                long flagged = produced.stream().filter(AnomalyRecord::flagged).count();
                log.debug("{} on {}: {} evaluated, {} flagged", detector.name(), series.construct(), produced.size(), flagged);
                records.addAll(produced);
            } catch (RuntimeException e) {
                log.error("Detector {} failed on {}: {}", detector.name(), series.construct(), e.getMessage(), e);
            }
        }
        return records;
    }
}
