package com.mindtrends.monitor.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record PipelineResult(PipelineRun run,
                             Map<String, ConstructReport> reports,
                             List<EventCorrelation> eventCorrelations) {

    public Optional<ConstructReport> report(String construct) {
        return Optional.ofNullable(reports.get(construct));
    }
}
