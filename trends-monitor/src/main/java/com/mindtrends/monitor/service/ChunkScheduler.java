package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a long date range into request windows the upstream will accept.
 *
 * Daily resolution is only served for short windows, and each window comes back
 * normalised to its own 0-100 scale. Consecutive windows therefore share
 * {@code overlapDays} calendar days so the reconciler can calibrate one against the next.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChunkScheduler {

    private final TrendsMonitorProperties properties;

    public List<ChunkWindow> plan(String construct, DateRange range) {
        TrendsMonitorProperties.Chunking chunking = properties.getChunking();
        return plan(construct, range.start(), range.end(), chunking.getMaxSpanDays(), chunking.getOverlapDays());
    }

    /**
     * @param maxSpanDays upper bound on {@code end - start} of any window
     * @param overlapDays calendar days shared by consecutive windows, {@code 0 <= overlap < maxSpan}
     * @return windows in chronological order; the last one ends on {@code end}
     */
    public List<ChunkWindow> plan(String construct, LocalDate start, LocalDate end,
                                  int maxSpanDays, int overlapDays) {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid range " + start + ".." + end);
        }
        if (maxSpanDays <= 0) {
            throw new IllegalArgumentException("maxSpanDays must be positive, got " + maxSpanDays);
        }
        if (overlapDays < 0 || overlapDays >= maxSpanDays) {
            throw new IllegalArgumentException(
                    "overlapDays must be in [0, " + maxSpanDays + "), got " + overlapDays);
        }

        if (ChronoUnit.DAYS.between(start, end) <= maxSpanDays) {
            return List.of(new ChunkWindow(construct, start, end));
        }

        List<ChunkWindow> windows = new ArrayList<>();
        LocalDate cursor = start;
        while (true) {
            LocalDate windowEnd = cursor.plusDays(maxSpanDays);
            if (windowEnd.isAfter(end)) {
                windowEnd = end;
            }
            windows.add(new ChunkWindow(construct, cursor, windowEnd));
            if (windowEnd.equals(end)) {
                break;
            }
            cursor = overlapDays == 0 ? windowEnd.plusDays(1) : windowEnd.minusDays(overlapDays - 1L);
        }
        return windows;
    }

    /** Plans every construct over the same range, keeping the given construct order. */
    public Map<String, List<ChunkWindow>> planAll(List<String> constructs, DateRange range) {
        Map<String, List<ChunkWindow>> plan = new LinkedHashMap<>();
        for (String construct : constructs) {
            plan.put(construct, plan(construct, range));
        }
        int total = plan.values().stream().mapToInt(List::size).sum();
        log.info("Planned {} windows for {} constructs over {}", total, plan.size(), range);
        return plan;
    }
}
