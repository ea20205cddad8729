package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.mindtrends.monitor.detection.DetectorFixtures.START;
import static com.mindtrends.monitor.detection.DetectorFixtures.baseline;
import static com.mindtrends.monitor.detection.DetectorFixtures.flaggedDates;
import static com.mindtrends.monitor.detection.DetectorFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ModifiedZScoreDetector")
class ModifiedZScoreDetectorTest {

    private final ModifiedZScoreDetector detector = new ModifiedZScoreDetector(3.5);

    @Test
    @DisplayName("One extreme outlier among constant values is the only flag")
    void flagsOutlierWhenMadIsZero() {
        double[] values = new double[30];
        Arrays.fill(values, 50.0);
        values[12] = 95.0;

        List<AnomalyRecord> records = detector.evaluate(series(values), null);

        assertThat(records).hasSize(30);
        assertThat(flaggedDates(records)).containsExactly(START.plusDays(12));
    }

    @Test
    @DisplayName("Outlier among noisy values is flagged against median and MAD")
    void flagsOutlierInNoise() {
        double[] values = new double[31];
        for (int i = 0; i < 30; i++) {
            values[i] = i % 2 == 0 ? 49.0 : 51.0;
        }
        values[30] = 90.0;

        assertThat(flaggedDates(detector.evaluate(series(values), null))).containsExactly(START.plusDays(30));
    }

    @Test
    @DisplayName("Baseline median and MAD are used when available")
    void usesBaseline() {
        List<AnomalyRecord> records = detector.evaluate(series(50.0, 60.0), baseline(50.0, 5.0, 50.0, 2.0));

        assertThat(records.get(1).score()).isCloseTo(10.0 * ModifiedZScoreDetector.CONSISTENCY / 2.0, within(1e-9));
        assertThat(records.get(1).flagged()).isFalse();
    }

    @Test
    @DisplayName("Flat series produce no records")
    void flatSeries() {
        assertThat(detector.evaluate(series(7.0, 7.0, 7.0), null)).isEmpty();
    }
}
