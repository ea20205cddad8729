package com.mindtrends.monitor.model;

import java.util.Comparator;
import java.util.List;

/**
 * Raw values for one window, on the window's own 0-100 scale, ordered by date.
 */
public record SeriesChunk(ChunkWindow window, List<DailyValue> values) implements ChunkResult {

    public SeriesChunk {
        values = values == null
                ? List.of()
                : values.stream().sorted(Comparator.comparing(DailyValue::date)).toList();
    }

    @Override
    public boolean isSuccess() {
        return true;
    }
}
