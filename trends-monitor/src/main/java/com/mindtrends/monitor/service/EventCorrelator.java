package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.ConsensusFlag;
import com.mindtrends.monitor.model.EventCorrelation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Matches consensus anomalies against the configured calendar of major events.
 * An event is reported when at least one anomaly falls within {@code windowDays} of it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventCorrelator {

    private final TrendsMonitorProperties properties;

    public List<EventCorrelation> correlate(Collection<ConsensusFlag> flags) {
        int windowDays = properties.getEvents().getWindowDays();
        List<EventCorrelation> correlations = new ArrayList<>();

        for (TrendsMonitorProperties.Events.Event event : properties.getEvents().getCalendar()) {
            LocalDate eventDate = parse(event.getDate());
            if (eventDate == null) {
                continue;
            }
            LocalDate from = eventDate.minusDays(windowDays);
            LocalDate to = eventDate.plusDays(windowDays);

            List<ConsensusFlag> nearby = flags.stream()
                    .filter(f -> !f.date().isBefore(from) && !f.date().isAfter(to))
                    .toList();
            if (nearby.isEmpty()) {
                continue;
            }

            List<String> constructs = nearby.stream().map(ConsensusFlag::construct).distinct().sorted().toList();
            correlations.add(new EventCorrelation(event.getLabel(), eventDate, nearby.size(), constructs));
        }

        log.info("{} of {} calendar events have nearby anomalies", correlations.size(),
                properties.getEvents().getCalendar().size());
        return correlations;
    }

    private LocalDate parse(String date) {
        if (date == null || date.isBlank()) {
            log.warn("Ignoring event without a date");
            return null;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring event with unparseable date: {}", date);
            return null;
        }
    }
}
