package com.mindtrends.monitor.scheduler;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.config.TrendsMonitorProperties.Output.OutputMode;
import com.mindtrends.monitor.output.ClickHouseWriter;
import com.mindtrends.monitor.service.TrendsPipelineService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup pipeline runs.
 *
 * Default schedule: daily at 03:30 UTC. Override with the TRENDS_CRON env var
 * or the trends-monitor.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final TrendsPipelineService pipelineService;
    private final ClickHouseWriter clickHouseWriter;
    private final TrendsMonitorProperties properties;

    /**
     * On application startup:
     *  1. Ensure the database schema exists unless output is CSV-only
     *  2. Optionally start a full run if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != OutputMode.CSV) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, starting a full run");
            new Thread(this::scheduledRun, "startup-pipeline-run").start();
        } else {
            log.info("Pipeline ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${trends-monitor.scheduling.cron:0 30 3 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        try {
            pipelineService.run();
        } catch (IllegalStateException e) {
            log.warn("Skipping scheduled run: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled pipeline run failed: {}", e.getMessage(), e);
        }
    }
}
