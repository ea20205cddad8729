package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.util.List;

public record EventCorrelation(String event, LocalDate eventDate, int anomalyCount, List<String> constructs) {}
