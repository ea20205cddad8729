package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.TrendsApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps raw interest-over-time responses to daily values for one window.
 */
@Component
@Slf4j
public class TrendsResponseMapper {

    /**
     * Keep only complete, in-window points with a value in [0, 100].
     * Points the upstream marks as partial are still being collected and would
     * distort the calibration overlap, so they are dropped too.
     */
    public List<DailyValue> map(TrendsApiResponse response, ChunkWindow window) {
        if (response == null || response.getPoints() == null) {
            return List.of();
        }

        List<DailyValue> values = new ArrayList<>(response.getPoints().size());
        int skipped = 0;

        for (TrendsApiResponse.Point point : response.getPoints()) {
            LocalDate date = parseDate(point.getDate());
            Double value = point.getValue();
            if (date == null || value == null || point.isPartial()
                    || !window.contains(date) || value.isNaN() || value < 0.0 || value > 100.0) {
                skipped++;
                continue;
            }
            values.add(new DailyValue(date, value));
        }

        if (skipped > 0) {
            log.debug("Skipped {} unusable points for {}", skipped, window);
        }

        values.sort(Comparator.comparing(DailyValue::date));
        return dedupe(values);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        // Timestamps like 2020-06-01T00:00:00 are cut to the calendar date
        String trimmed = raw.trim();
        try {
            return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** First value wins for a repeated date. */
    private List<DailyValue> dedupe(List<DailyValue> sorted) {
        List<DailyValue> unique = new ArrayList<>(sorted.size());
        for (DailyValue value : sorted) {
            if (unique.isEmpty() || !unique.get(unique.size() - 1).date().equals(value.date())) {
                unique.add(value);
            }
        }
        return unique;
    }
}
