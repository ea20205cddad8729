package com.mindtrends.monitor.model;

import java.time.LocalDate;

/**
 * Mean level and peak of a comparison period, set against the baseline mean.
 */
public record PeriodImpact(String construct,
                           DateRange period,
                           double baselineMean,
                           double periodMean,
                           double percentChange,
                           double peakValue,
                           LocalDate peakDate) {}
