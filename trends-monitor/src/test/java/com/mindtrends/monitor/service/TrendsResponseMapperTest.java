package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.TrendsApiResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.mindtrends.monitor.service.HttpTrendsQueryClientTest.point;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrendsResponseMapper")
class TrendsResponseMapperTest {

    private final TrendsResponseMapper mapper = new TrendsResponseMapper();
    private final ChunkWindow window = new ChunkWindow("burnout",
            LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 10));

    @Test
    @DisplayName("Skips partial, out-of-window, out-of-range and unparseable points")
    void skipsUnusablePoints() {
        TrendsApiResponse response = new TrendsApiResponse();
        response.setPoints(List.of(
                point("2021-01-03", 30.0, false),
                point("2021-01-02T00:00:00", 20.0, false),
                point("2021-01-04", 35.0, true),
                point("2020-12-31", 10.0, false),
                point("2021-01-05", 120.0, false),
                point("2021-01-06", -1.0, false),
                point("not-a-date", 50.0, false),
                point("2021-01-07", null, false)));

        List<DailyValue> values = mapper.map(response, window);

        assertThat(values).containsExactly(
                new DailyValue(LocalDate.of(2021, 1, 2), 20.0),
                new DailyValue(LocalDate.of(2021, 1, 3), 30.0));
    }

    @Test
    @DisplayName("Repeated dates keep the first value")
    void dedupesDates() {
        TrendsApiResponse response = new TrendsApiResponse();
        response.setPoints(List.of(point("2021-01-02", 20.0, false), point("2021-01-02", 25.0, false)));

        assertThat(mapper.map(response, window)).containsExactly(new DailyValue(LocalDate.of(2021, 1, 2), 20.0));
    }

    @Test
    @DisplayName("Null response or points map to an empty list")
    void nullResponse() {
        assertThat(mapper.map(null, window)).isEmpty();
        assertThat(mapper.map(new TrendsApiResponse(), window)).isEmpty();
    }
}
