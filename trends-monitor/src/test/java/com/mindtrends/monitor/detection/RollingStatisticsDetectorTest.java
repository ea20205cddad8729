package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.DataGap;
import com.mindtrends.monitor.model.GapReason;
import com.mindtrends.monitor.model.ObservationSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.mindtrends.monitor.detection.DetectorFixtures.START;
import static com.mindtrends.monitor.detection.DetectorFixtures.baseline;
import static com.mindtrends.monitor.detection.DetectorFixtures.flaggedDates;
import static com.mindtrends.monitor.detection.DetectorFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RollingStatisticsDetector")
class RollingStatisticsDetectorTest {

    private final RollingStatisticsDetector detector = new RollingStatisticsDetector(30, 2.5);

    @Test
    @DisplayName("Linear trend is not flagged, a proportional spike on it is")
    void trendWithSpike() {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10.0 + 0.5 * i;
        }
        values[70] *= 1.5;

        List<AnomalyRecord> records = detector.evaluate(series(values), null);

        // The first window of points has no trailing reference
        assertThat(records).hasSize(70);
        assertThat(flaggedDates(records)).containsExactly(START.plusDays(70));
    }

    @Test
    @DisplayName("Series no longer than the window is skipped without a baseline")
    void shortSeriesWithoutBaseline() {
        assertThat(detector.evaluate(series(1.0, 2.0, 3.0), null)).isEmpty();
    }

    @Test
    @DisplayName("Baseline seeds the points before the first full window")
    void seededByBaseline() {
        List<AnomalyRecord> records = detector.evaluate(series(10.0, 15.0, 10.5), baseline(10.0, 1.0, 10.0, 1.0));

        assertThat(records).hasSize(3);
        assertThat(flaggedDates(records)).containsExactly(START.plusDays(1));
    }

    @Test
    @DisplayName("Trailing window restarts after a marked gap instead of spanning it")
    void windowRestartsAfterGap() {
        List<DailyValue> points = new ArrayList<>();
        for (int day = 0; day < 30; day++) {
            points.add(new DailyValue(START.plusDays(day), day % 2 == 0 ? 10.0 : 11.0));
        }
        for (int day = 60; day < 70; day++) {
            points.add(new DailyValue(START.plusDays(day), day % 2 == 0 ? 50.0 : 51.0));
        }
        DataGap gap = new DataGap(START.plusDays(30), START.plusDays(59), GapReason.RETRIES_EXHAUSTED);
        ObservationSeries series = new ObservationSeries("anxiety", points, List.of(gap), List.of());

        List<AnomalyRecord> records = new RollingStatisticsDetector(5, 2.5).evaluate(series, null);

        // Days 5-29 before the gap and 65-69 after it have a full trailing window
        assertThat(records).hasSize(30);
        assertThat(records).noneMatch(r -> r.date().isAfter(START.plusDays(59)) && r.date().isBefore(START.plusDays(65)));
        assertThat(flaggedDates(records)).isEmpty();
    }

    @Test
    @DisplayName("Window below two is rejected")
    void invalidWindow() {
        assertThatThrownBy(() -> new RollingStatisticsDetector(1, 2.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
