package com.mindtrends.monitor.output;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.ConstructReport;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.DataGap;
import com.mindtrends.monitor.model.PipelineResult;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a run's series, gaps and anomaly report to CSV files.
 *
 * Output path pattern: {outputDir}/{table}_{runDate}.csv
 * e.g. /data/output/trend_observations_2024-05-01.csv
 *
 * These CSVs can be loaded into ClickHouse via:
 *   INSERT INTO search_trends.observations FROM INFILE '/data/output/trend_observations_*.csv' FORMAT CSVWithNames
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private final TrendsMonitorProperties properties;

    static final String[] OBSERVATION_HEADERS = {"construct", "date", "value"};

    static final String[] GAP_HEADERS = {"construct", "start_date", "end_date", "reason"};

    static final String[] ANOMALY_HEADERS = {
            "construct", "date", "detector_name",
            "value", "score", "flagged", "relative_change"
    };

    public List<Path> write(PipelineResult result) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);
        LocalDate runDate = result.run().getStartedAt().toLocalDate();

        List<String[]> observations = new ArrayList<>();
        List<String[]> gaps = new ArrayList<>();
        List<String[]> anomalies = new ArrayList<>();
        for (ConstructReport report : result.reports().values()) {
            for (DailyValue point : report.series().observations()) {
                observations.add(new String[]{report.construct(), point.date().toString(), str(point.value())});
            }
            for (DataGap gap : report.series().gaps()) {
                gaps.add(new String[]{report.construct(), gap.start().toString(), gap.end().toString(), gap.reason().name()});
            }
            for (AnomalyRecord r : report.anomalies()) {
                anomalies.add(toRow(r));
            }
        }

        return List.of(
                writeFile(outputDir.resolve("trend_observations_" + runDate + ".csv"), OBSERVATION_HEADERS, observations),
                writeFile(outputDir.resolve("data_gaps_" + runDate + ".csv"), GAP_HEADERS, gaps),
                writeFile(outputDir.resolve("anomaly_records_" + runDate + ".csv"), ANOMALY_HEADERS, anomalies));
    }

    private Path writeFile(Path outputPath, String[] headers, List<String[]> rows) {
        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            writer.writeAll(rows);

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(AnomalyRecord r) {
        return new String[]{
                r.construct(),
                r.date().toString(),
                r.detectorName(),
                str(r.value()),
                str(r.score()),
                String.valueOf(r.flagged()),
                str(r.relativeChange())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
