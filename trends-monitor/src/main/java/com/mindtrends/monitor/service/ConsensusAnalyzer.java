package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.ConsensusFlag;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds dates where several detectors agree. Agreement between methods with different
 * assumptions is the higher-confidence signal reported downstream.
 */
@Component
public class ConsensusAnalyzer {

    public List<ConsensusFlag> consensus(List<AnomalyRecord> records, int minAgreement) {
        Map<Map.Entry<String, LocalDate>, List<AnomalyRecord>> byPoint = new LinkedHashMap<>();
        for (AnomalyRecord record : records) {
            if (record.flagged()) {
                byPoint.computeIfAbsent(new SimpleImmutableEntry<>(record.construct(), record.date()),
                        key -> new ArrayList<>()).add(record);
            }
        }

        List<ConsensusFlag> flags = new ArrayList<>();
        for (Map.Entry<Map.Entry<String, LocalDate>, List<AnomalyRecord>> entry : byPoint.entrySet()) {
            List<String> detectors = entry.getValue().stream()
                    .map(AnomalyRecord::detectorName)
                    .distinct()
                    .toList();
            if (detectors.size() >= Math.max(1, minAgreement)) {
                flags.add(new ConsensusFlag(entry.getKey().getKey(), entry.getKey().getValue(),
                        entry.getValue().get(0).value(), detectors));
            }
        }

        flags.sort(Comparator.comparing(ConsensusFlag::construct).thenComparing(ConsensusFlag::date));
        return flags;
    }
}
