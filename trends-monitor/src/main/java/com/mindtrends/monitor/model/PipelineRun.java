package com.mindtrends.monitor.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Bookkeeping for one pipeline run. Stored in the pipeline_runs table.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private LocalDate rangeStart;
    private LocalDate rangeEnd;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED
    private int constructs;
    private int chunksRequested;
    private int chunksFailed;
    private long gapDays;
    private long anomaliesFlagged;
    private boolean timedOut;
    private String errorMessage;    // null on success
}
