package com.mindtrends.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for the interest-over-time endpoint.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrendsApiResponse {

    private String term;

    private List<Point> points;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        private String date;        // yyyy-MM-dd
        private Double value;       // 0-100, relative to the requested window
        private boolean partial;    // the upstream is still collecting this day
    }
}
