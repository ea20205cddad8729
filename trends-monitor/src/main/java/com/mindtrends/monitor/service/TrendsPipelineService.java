package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.detection.AnomalyEnsemble;
import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineResult;
import com.mindtrends.monitor.model.ChunkResult;
import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.ConsensusFlag;
import com.mindtrends.monitor.model.ConstructReport;
import com.mindtrends.monitor.model.DateRange;
import com.mindtrends.monitor.model.EventCorrelation;
import com.mindtrends.monitor.model.FailureKind;
import com.mindtrends.monitor.model.FetchFailure;
import com.mindtrends.monitor.model.ObservationSeries;
import com.mindtrends.monitor.model.PeriodImpact;
import com.mindtrends.monitor.model.PipelineResult;
import com.mindtrends.monitor.model.PipelineRun;
import com.mindtrends.monitor.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one acquisition, reconciliation and detection cycle.
 *
 * Fetching is the only parallel I/O stage: every planned window becomes one task on a
 * per-run bounded pool sharing a single rate limiter. When the run timeout expires the
 * unfinished windows become retriable TIMEOUT failures and the run carries on with what
 * it has, so a slow upstream yields a PARTIAL run with gaps rather than no data.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrendsPipelineService {

    private final ChunkScheduler chunkScheduler;
    private final FetcherFactory fetcherFactory;
    private final ContinuityReconciler reconciler;
    private final AnomalyEnsemble ensemble;
    private final BaselineComparator baselineComparator;
    private final ConsensusAnalyzer consensusAnalyzer;
    private final EventCorrelator eventCorrelator;
    private final OutputRouter outputRouter;
    private final TrendsMonitorProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PipelineResult> latest = new AtomicReference<>();

    /** Run over the configured constructs and range, ending today unless configured otherwise. */
    public PipelineResult run() {
        DateRange range = properties.getRange().resolve(LocalDate.now(clock));
        return run(properties.getConstructs(), range);
    }

    public PipelineResult run(List<String> constructs, DateRange range) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }

        List<String> unique = normalise(constructs);
        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .rangeStart(range.start())
                .rangeEnd(range.end())
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .constructs(unique.size())
                .build();
        log.info("Pipeline run {} started: {} constructs over {}", run.getRunId(), unique.size(), range);

        try {
            Map<String, List<ChunkWindow>> plan = chunkScheduler.planAll(unique, range);
            List<ChunkWindow> windows = plan.values().stream().flatMap(List::stream).toList();
            run.setChunksRequested(windows.size());

            List<ChunkResult> fetched = fetchAll(run, windows);
            run.setChunksFailed((int) fetched.stream().filter(r -> !r.isSuccess()).count());

            Map<String, List<ChunkResult>> byConstruct = new LinkedHashMap<>();
            unique.forEach(c -> byConstruct.put(c, new ArrayList<>()));
            fetched.forEach(r -> byConstruct.get(r.window().construct()).add(r));

            Map<String, ConstructReport> analyzed = new ConcurrentHashMap<>();
            byConstruct.entrySet().parallelStream()
                    .forEach(e -> analyzed.put(e.getKey(), analyze(e.getKey(), e.getValue())));

            Map<String, ConstructReport> reports = new LinkedHashMap<>();
            unique.forEach(c -> reports.put(c, analyzed.get(c)));

            List<ConsensusFlag> allFlags = reports.values().stream()
                    .flatMap(r -> r.consensus().stream())
                    .toList();
            List<EventCorrelation> correlations = eventCorrelator.correlate(allFlags);

            run.setGapDays(reports.values().stream().mapToLong(r -> r.series().gapDays()).sum());
            run.setAnomaliesFlagged(reports.values().stream().mapToLong(ConstructReport::flaggedCount).sum());
            boolean degraded = run.isTimedOut() || run.getChunksFailed() > 0
                    || reports.values().stream().anyMatch(ConstructReport::failed);
            run.setStatus(degraded ? "PARTIAL" : "SUCCESS");

            PipelineResult result = new PipelineResult(run, reports, correlations);
            outputRouter.write(result);
            latest.set(result);

            log.info("Pipeline run {} finished {}: {}/{} chunks failed, {} gap days, {} anomalies flagged",
                    run.getRunId(), run.getStatus(), run.getChunksFailed(), run.getChunksRequested(),
                    run.getGapDays(), run.getAnomaliesFlagged());
            return result;

        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            outputRouter.writePipelineRun(run);
            running.set(false);
        }
    }

    public Optional<PipelineResult> latest() {
        return Optional.ofNullable(latest.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Trimmed, non-blank, distinct constructs in their given order. */
    static List<String> normalise(List<String> constructs) {
        if (constructs == null) {
            return List.of();
        }
        List<String> unique = constructs.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(construct -> !construct.isEmpty())
                .distinct()
                .toList();
        if (unique.size() < constructs.size()) {
            log.warn("Ignoring {} null, blank or duplicate construct entries", constructs.size() - unique.size());
        }
        return unique;
    }

    /** Results come back in the same order as {@code windows}. */
    List<ChunkResult> fetchAll(PipelineRun run, List<ChunkWindow> windows) {
        if (windows.isEmpty()) {
            return List.of();
        }

        RateLimitedFetcher fetcher = fetcherFactory.create(run.getRunId());
        int threads = Math.max(1, Math.min(properties.getPipeline().getMaxConcurrency(), windows.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("trends-fetch-"));

        List<Callable<ChunkResult>> tasks = windows.stream()
                .<Callable<ChunkResult>>map(w -> () -> fetcher.fetch(w))
                .toList();
        long timeoutMs = properties.getPipeline().getRunTimeout().toMillis();

        try {
            List<Future<ChunkResult>> futures = executor.invokeAll(tasks, timeoutMs, TimeUnit.MILLISECONDS);
            List<ChunkResult> results = new ArrayList<>(windows.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(run, windows.get(i), futures.get(i)));
            }
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {} interrupted while fetching; unfetched windows are recorded as timeouts", run.getRunId());
            run.setTimedOut(true);
            return windows.stream().<ChunkResult>map(this::timedOut).toList();
        } finally {
            executor.shutdownNow();
        }
    }

    private ChunkResult collect(PipelineRun run, ChunkWindow window, Future<ChunkResult> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            run.setTimedOut(true);
            log.warn("Run timeout reached before {} was fetched", window);
            return timedOut(window);
        } catch (ExecutionException e) {
            log.error("Fetch task for {} failed unexpectedly: {}", window, e.getCause().getMessage(), e.getCause());
            return FetchFailure.of(window, FailureKind.CLIENT_ERROR, String.valueOf(e.getCause().getMessage()), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.setTimedOut(true);
            return timedOut(window);
        }
    }

    private FetchFailure timedOut(ChunkWindow window) {
        return new FetchFailure(window, FailureKind.TIMEOUT, true, "Run timeout reached before the window was fetched", 0);
    }

    ConstructReport analyze(String construct, List<ChunkResult> chunks) {
        int failed = (int) chunks.stream().filter(r -> !r.isSuccess()).count();
        ObservationSeries series = ObservationSeries.empty(construct, List.of());
        try {
            series = reconciler.reconcile(construct, chunks);

            BaselineResult baseline = baselineComparator.compare(series, properties.getBaseline().toRange());
            List<AnomalyRecord> records = ensemble.detect(series, baseline.statisticsIfSufficient().orElse(null));
            records = baselineComparator.annotate(records, baseline);

            List<ConsensusFlag> consensus = consensusAnalyzer.consensus(records, properties.getDetection().getMinAgreement());

            PeriodImpact impact = null;
            if (properties.getComparison().isEnabled()) {
                impact = baselineComparator.impact(series, baseline, properties.getComparison().toRange()).orElse(null);
            }

            log.info("{}: {} observations, {} records, {} consensus anomalies", construct, series.size(),
                    records.size(), consensus.size());
            return new ConstructReport(construct, series, records, baseline, consensus, impact,
                    chunks.size(), failed, null);

        } catch (RuntimeException e) {
            log.error("Analysis failed for {}: {}", construct, e.getMessage(), e);
            BaselineResult baseline = BaselineResult.insufficient(construct, properties.getBaseline().toRange(),
                    0.0, "analysis failed");
            return new ConstructReport(construct, series, List.of(), baseline, List.of(), null,
                    chunks.size(), failed, String.valueOf(e.getMessage()));
        }
    }
}
