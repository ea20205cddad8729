package com.mindtrends.monitor.config;

import com.mindtrends.monitor.model.DateRange;
import com.mindtrends.monitor.service.ContinuityReconciler.OverlapPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "trends-monitor")
@Data
public class TrendsMonitorProperties {

    private List<String> constructs = new ArrayList<>(List.of(
            "depression", "anxiety", "therapy", "burnout", "mental health",
            "panic attack", "stress", "counseling", "psychiatrist", "antidepressants"));

    private Range range = new Range();
    private Baseline baseline = new Baseline();
    private Comparison comparison = new Comparison();
    private Chunking chunking = new Chunking();
    private Api api = new Api();
    private Pipeline pipeline = new Pipeline();
    private Reconciliation reconciliation = new Reconciliation();
    private Detection detection = new Detection();
    private Events events = new Events();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Range {
        private String start = "2018-01-01";
        /** Blank means "today" at run time. */
        private String end = "";

        public DateRange resolve(LocalDate today) {
            LocalDate resolvedEnd = end == null || end.isBlank() ? today : LocalDate.parse(end);
            return new DateRange(LocalDate.parse(start), resolvedEnd);
        }
    }

    @Data
    public static class Baseline {
        private String start = "2018-01-01";
        private String end = "2020-02-29";
        /** Largest tolerated fraction of baseline days without data. */
        private double coverageTolerance = 0.05;

        public DateRange toRange() {
            return DateRange.of(start, end);
        }
    }

    @Data
    public static class Comparison {
        /** Both blank disables the period impact analysis. */
        private String start = "2020-03-01";
        private String end = "2021-06-30";

        public boolean isEnabled() {
            return start != null && !start.isBlank() && end != null && !end.isBlank();
        }

        public DateRange toRange() {
            return DateRange.of(start, end);
        }
    }

    @Data
    public static class Chunking {
        /** Upstream limit on end - start of one daily-resolution request. */
        private int maxSpanDays = 180;
        /** Calendar days shared by consecutive windows, used to calibrate scales. */
        private int overlapDays = 30;
    }

    @Data
    public static class Api {
        private String baseUrl = "http://localhost:8090/api/trends";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(25);
        /** Minimum spacing between requests across all constructs. */
        private long requestIntervalMs = 5000;
        /** How long a worker may wait for a request permit before giving up the attempt. */
        private Duration permitTimeout = Duration.ofMinutes(5);
        private int maxAttempts = 3;
        private long backoffBaseMs = 10_000;
        private double backoffMultiplier = 2.0;
        /** Randomization factor applied to each backoff interval (0 disables jitter). */
        private double jitterFactor = 0.5;
    }

    @Data
    public static class Pipeline {
        private int maxConcurrency = 2;
        private Duration runTimeout = Duration.ofMinutes(45);
    }

    @Data
    public static class Reconciliation {
        /** Uncovered runs up to this many days are left unmarked. */
        private int maxToleratedGapDays = 3;
        private OverlapPolicy overlapPolicy = OverlapPolicy.PREFER_LATER;
    }

    @Data
    public static class Detection {
        private double zscoreThreshold = 2.5;
        private double madThreshold = 3.5;
        private Isolation isolation = new Isolation();
        private Rolling rolling = new Rolling();
        /** Detectors that must agree before a date counts as a consensus anomaly. */
        private int minAgreement = 2;

        @Data
        public static class Isolation {
            private double contamination = 0.1;
            private int numberOfTrees = 50;
            private int sampleSize = 256;
            private int featureWindow = 7;
            private int minPoints = 20;
            private long randomSeed = 42L;
        }

        @Data
        public static class Rolling {
            private int window = 30;
            private double threshold = 2.5;
        }
    }

    @Data
    public static class Events {
        private int windowDays = 14;
        private List<Event> calendar = new ArrayList<>();

        @Data
        public static class Event {
            private String date;
            private String label;
        }
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 30 3 * * ?";
        private boolean runOnStartup = false;
    }
}
