package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mindtrends.monitor.detection.DetectorFixtures.START;
import static com.mindtrends.monitor.detection.DetectorFixtures.baseline;
import static com.mindtrends.monitor.detection.DetectorFixtures.flaggedDates;
import static com.mindtrends.monitor.detection.DetectorFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ZScoreDetector")
class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector(2.5);

    @Test
    @DisplayName("Only a spike ten noise deviations above the level is flagged")
    void flagsSpikeOnly() {
        double[] values = new double[60];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50.0 + (i % 2 == 0 ? 1.0 : -1.0);
        }
        values[40] = 60.0;

        List<AnomalyRecord> records = detector.evaluate(series(values), null);

        assertThat(records).hasSize(60).allMatch(r -> r.detectorName().equals(ZScoreDetector.NAME));
        assertThat(flaggedDates(records)).containsExactly(START.plusDays(40));
    }

    @Test
    @DisplayName("Baseline statistics take precedence over the series' own")
    void usesBaseline() {
        List<AnomalyRecord> records = detector.evaluate(series(50.0, 53.0, 51.0), baseline(50.0, 1.0, 50.0, 1.0));

        assertThat(records.get(1).score()).isCloseTo(3.0, within(1e-9));
        assertThat(flaggedDates(records)).containsExactly(START.plusDays(1));
    }

    @Test
    @DisplayName("Short or flat series produce no records")
    void degenerateInput() {
        assertThat(detector.evaluate(series(), null)).isEmpty();
        assertThat(detector.evaluate(series(42.0), null)).isEmpty();
        assertThat(detector.evaluate(series(5.0, 5.0, 5.0, 5.0), null)).isEmpty();
    }
}
