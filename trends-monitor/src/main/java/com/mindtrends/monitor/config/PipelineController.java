package com.mindtrends.monitor.config;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.ConstructReport;
import com.mindtrends.monitor.model.PipelineResult;
import com.mindtrends.monitor.service.ConsensusAnalyzer;
import com.mindtrends.monitor.service.TrendsPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final TrendsPipelineService pipelineService;
    private final ConsensusAnalyzer consensusAnalyzer;

    // ── Pipeline triggers ─────────────────────────────────────────────────────

    @PostMapping("/pipeline/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (pipelineService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A pipeline run is already in progress"));
        }
        new Thread(this::runQuietly, "manual-pipeline-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "trends-monitor");
        body.put("running", pipelineService.isRunning());
        pipelineService.latest().ifPresent(result -> {
            body.put("lastRun", result.run());
            body.put("eventCorrelations", result.eventCorrelations());
        });
        return ResponseEntity.ok(body);
    }

    // ── Result query API ──────────────────────────────────────────────────────

    /**
     * Reconciled series of the last completed run.
     *
     * GET /series/anxiety
     */
    @GetMapping("/series/{construct}")
    public ResponseEntity<?> series(@PathVariable String construct) {
        return report(construct)
                .<ResponseEntity<?>>map(r -> ResponseEntity.ok(r.series()))
                .orElseGet(() -> notFound(construct));
    }

    /**
     * Per-detector records, or consensus dates when {@code minAgreement} is given.
     *
     * GET /anomalies/anxiety?flaggedOnly=true
     * GET /anomalies/anxiety?minAgreement=3
     */
    @GetMapping("/anomalies/{construct}")
    public ResponseEntity<?> anomalies(
            @PathVariable String construct,
            @RequestParam(defaultValue = "false") boolean flaggedOnly,
            @RequestParam(required = false) Integer minAgreement) {
        Optional<ConstructReport> report = report(construct);
        if (report.isEmpty()) {
            return notFound(construct);
        }
        try {
            if (minAgreement != null) {
                if (minAgreement < 1) {
                    throw new IllegalArgumentException("minAgreement must be at least 1");
                }
                return ResponseEntity.ok(consensusAnalyzer.consensus(report.get().anomalies(), minAgreement));
            }
            List<AnomalyRecord> records = report.get().anomalies().stream()
                    .filter(r -> !flaggedOnly || r.flagged())
                    .toList();
            return ResponseEntity.ok(records);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Baseline statistics and the comparison-period impact.
     *
     * GET /baseline/anxiety
     */
    @GetMapping("/baseline/{construct}")
    public ResponseEntity<?> baseline(@PathVariable String construct) {
        return report(construct)
                .<ResponseEntity<?>>map(r -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("baseline", r.baseline());
                    body.put("impact", r.impact());
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> notFound(construct));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void runQuietly() {
        try {
            pipelineService.run();
        } catch (IllegalStateException e) {
            log.warn("Manual run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Manual pipeline run failed: {}", e.getMessage(), e);
        }
    }

    private Optional<ConstructReport> report(String construct) {
        return pipelineService.latest().flatMap((PipelineResult result) -> result.report(construct));
    }

    private ResponseEntity<Map<String, String>> notFound(String construct) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "No results for construct '" + construct + "'"));
    }
}
