package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.DailyValue;

import java.time.LocalDate;
import java.util.List;

/**
 * The one capability the pipeline needs from the upstream source: daily interest for a
 * construct over an inclusive window, each value on the window's own 0-100 scale.
 */
public interface TrendsQueryClient {

    /**
     * @return values ordered by date, never empty
     * @throws TransientFetchException when a later attempt may succeed
     * @throws PermanentFetchException when the request can never succeed
     */
    List<DailyValue> query(String construct, LocalDate start, LocalDate end);
}
