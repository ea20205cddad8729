package com.mindtrends.monitor.output;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.ConstructReport;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.DataGap;
import com.mindtrends.monitor.model.PipelineResult;
import com.mindtrends.monitor.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS search_trends");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_trends.observations
            (
                construct           LowCardinality(String),
                obs_date            Date,
                value               Float64,
                run_id              String,
                written_at          DateTime DEFAULT now()
            )
            ENGINE = ReplacingMergeTree(written_at)
            PARTITION BY toYear(obs_date)
            ORDER BY (construct, obs_date)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_trends.data_gaps
            (
                construct           LowCardinality(String),
                start_date          Date,
                end_date            Date,
                reason              LowCardinality(String),
                run_id              String
            )
            ENGINE = MergeTree()
            ORDER BY (construct, start_date, run_id)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_trends.anomaly_records
            (
                construct           LowCardinality(String),
                obs_date            Date,
                detector_name       LowCardinality(String),
                value               Float64,
                score               Float64,
                flagged             UInt8,
                relative_change     Nullable(Float64),
                run_id              String,
                written_at          DateTime DEFAULT now()
            )
            ENGINE = ReplacingMergeTree(written_at)
            PARTITION BY toYear(obs_date)
            ORDER BY (construct, obs_date, detector_name)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_trends.pipeline_runs
            (
                run_id              String,
                range_start         Date,
                range_end           Date,
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                constructs          Int32,
                chunks_requested    Int32,
                chunks_failed       Int32,
                gap_days            Int64,
                anomalies_flagged   Int64,
                timed_out           UInt8,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, run_id)
        """);

        log.info("ClickHouse schema ready.");
    }

    public void write(PipelineResult result) {
        String runId = result.run().getRunId();
        List<String> observations = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        List<String> anomalies = new ArrayList<>();

        for (ConstructReport report : result.reports().values()) {
            for (DailyValue point : report.series().observations()) {
                observations.add(String.format("(%s,%s,%s,%s)",
                        sqlStr(report.construct()), sqlStr(point.date()), point.value(), sqlStr(runId)));
            }
            for (DataGap gap : report.series().gaps()) {
                gaps.add(String.format("(%s,%s,%s,%s,%s)",
                        sqlStr(report.construct()), sqlStr(gap.start()), sqlStr(gap.end()),
                        sqlStr(gap.reason().name()), sqlStr(runId)));
            }
            for (AnomalyRecord r : report.anomalies()) {
                anomalies.add(toValueRow(r, runId));
            }
        }

        insertBatched("search_trends.observations (construct, obs_date, value, run_id)", observations);
        insertBatched("search_trends.data_gaps (construct, start_date, end_date, reason, run_id)", gaps);
        insertBatched("search_trends.anomaly_records (construct, obs_date, detector_name, value, score, flagged,"
                + " relative_change, run_id)", anomalies);
    }

    /**
     * One INSERT ... VALUES statement per batch. This is the most reliable approach with the
     * ClickHouse JDBC driver and avoids PreparedStatement batch handling.
     */
    private void insertBatched(String target, List<String> rows) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        log.info("Writing {} rows to {} in batches of {}", total, target.substring(0, target.indexOf(' ')), BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<String> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                jdbcTemplate.execute("INSERT INTO " + target + " VALUES\n"
                        + batch.stream().collect(Collectors.joining(",\n")));
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }
    }

    private String toValueRow(AnomalyRecord r, String runId) {
        return String.format("(%s,%s,%s,%s,%s,%d,%s,%s)",
                sqlStr(r.construct()),
                sqlStr(r.date()),
                sqlStr(r.detectorName()),
                r.value(),
                r.score(),
                r.flagged() ? 1 : 0,
                r.relativeChange() != null ? r.relativeChange().toString() : "NULL",
                sqlStr(runId)
        );
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            String sql = String.format("""
                INSERT INTO search_trends.pipeline_runs
                (run_id, range_start, range_end, started_at, completed_at, status, constructs,
                 chunks_requested, chunks_failed, gap_days, anomalies_flagged, timed_out, error_message)
                VALUES (%s,%s,%s,%s,%s,%s,%d,%d,%d,%d,%d,%d,%s)
                """,
                    sqlStr(run.getRunId()),
                    sqlStr(run.getRangeStart()),
                    sqlStr(run.getRangeEnd()),
                    sqlDateTime(run.getStartedAt()),
                    sqlDateTime(run.getCompletedAt()),
                    sqlStr(run.getStatus()),
                    run.getConstructs(),
                    run.getChunksRequested(),
                    run.getChunksFailed(),
                    run.getGapDays(),
                    run.getAnomaliesFlagged(),
                    run.isTimedOut() ? 1 : 0,
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run: {}", e.getMessage());
        }
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlDateTime(LocalDateTime val) {
        return val == null ? "NULL" : "'" + DATETIME.format(val) + "'";
    }
}
