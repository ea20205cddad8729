package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.ObservationSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static com.mindtrends.monitor.detection.DetectorFixtures.START;
import static com.mindtrends.monitor.detection.DetectorFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnomalyEnsemble")
class AnomalyEnsembleTest {

    @Mock private AnomalyDetector broken;
    @Mock private AnomalyDetector working;

    @Test
    @DisplayName("A failing detector is skipped and the others still report")
    void isolatesFailingDetector() {
        ObservationSeries series = series(1.0, 2.0, 3.0);
        AnomalyRecord record = AnomalyRecord.of("anxiety", START, "working", 1.0, 0.2, false);
        when(broken.name()).thenReturn("broken");
        when(broken.evaluate(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(working.name()).thenReturn("working");
        when(working.evaluate(series, null)).thenReturn(List.of(record));

        List<AnomalyRecord> records = new AnomalyEnsemble(List.of(broken, working)).detect(series);

        assertThat(records).containsExactly(record);
    }

    @Test
    @DisplayName("Real detectors each report on every point they can evaluate")
    void realDetectors() {
        double[] values = new double[40];
        Arrays.fill(values, 30.0);
        for (int i = 0; i < values.length; i += 3) {
            values[i] = 32.0;
        }
        values[35] = 90.0;
        AnomalyEnsemble ensemble = new AnomalyEnsemble(List.of(
                new ZScoreDetector(2.5), new ModifiedZScoreDetector(3.5), new RollingStatisticsDetector(10, 2.5)));

        List<AnomalyRecord> records = ensemble.detect(series(values));

        assertThat(ensemble.detectorNames())
                .containsExactly(ZScoreDetector.NAME, ModifiedZScoreDetector.NAME, RollingStatisticsDetector.NAME);
        assertThat(records).filteredOn(r -> r.detectorName().equals(ZScoreDetector.NAME)).hasSize(40);
        assertThat(records).filteredOn(r -> r.detectorName().equals(RollingStatisticsDetector.NAME)).hasSize(30);
        assertThat(records).filteredOn(AnomalyRecord::flagged)
                .extracting(AnomalyRecord::detectorName)
                .contains(ZScoreDetector.NAME, ModifiedZScoreDetector.NAME, RollingStatisticsDetector.NAME);
    }
}
