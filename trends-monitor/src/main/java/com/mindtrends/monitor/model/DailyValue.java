package com.mindtrends.monitor.model;

import java.time.LocalDate;

public record DailyValue(LocalDate date, double value) {}
