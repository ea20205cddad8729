package com.mindtrends.monitor.output;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.config.TrendsMonitorProperties.Output.OutputMode;
import com.mindtrends.monitor.model.PipelineResult;
import com.mindtrends.monitor.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes. A failing sink is logged and
 * never fails the run that produced the data.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final TrendsMonitorProperties properties;

    public void write(PipelineResult result) {
        OutputMode mode = properties.getOutput().getMode();

        if (mode != OutputMode.CSV) {
            try {
                clickHouseWriter.write(result);
            } catch (Exception e) {
                log.warn("ClickHouse output failed for run {}: {}", result.run().getRunId(), e.getMessage());
            }
        }
        if (mode != OutputMode.CLICKHOUSE) {
            try {
                csvWriter.write(result);
            } catch (Exception e) {
                log.warn("CSV output failed for run {}: {}", result.run().getRunId(), e.getMessage());
            }
        }
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            if (properties.getOutput().getMode() != OutputMode.CSV) {
                clickHouseWriter.writePipelineRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }
}
