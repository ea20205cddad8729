package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.ChunkResult;
import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.FailureKind;
import com.mindtrends.monitor.model.FetchFailure;
import com.mindtrends.monitor.model.SeriesChunk;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches one window at a time and never throws.
 *
 * Every request attempt first takes a permit from the run's shared {@link RateLimiter}, so
 * concurrent workers cannot exceed the upstream request rate between them, and then waits
 * its turn on the run's {@link RequestSpacing}, so no two requests start closer together
 * than the configured interval. Transient
 * failures are retried by the {@link Retry} policy (exponential backoff with jitter); the
 * backoff sleep happens on the calling worker only. Whatever happens, the caller gets a
 * {@link ChunkResult} back.
 *
 * Instances are built per pipeline run by {@link FetcherFactory}.
 */
@Slf4j
public class RateLimitedFetcher {

    private final TrendsQueryClient client;
    private final RateLimiter rateLimiter;
    private final RequestSpacing spacing;
    private final Retry retry;

    public RateLimitedFetcher(TrendsQueryClient client, RateLimiter rateLimiter, RequestSpacing spacing, Retry retry) {
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.spacing = spacing;
        this.retry = retry;
    }

    public ChunkResult fetch(ChunkWindow window) {
        FetchFailure rejected = validate(window);
        if (rejected != null) {
            log.warn("Rejected {} without fetching: {}", window, rejected.message());
            return rejected;
        }

        AtomicInteger attempts = new AtomicInteger();
        try {
            List<DailyValue> values = retry.executeCallable(() -> attempt(window, attempts));
            log.debug("Fetched {} values for {} in {} attempt(s)", values.size(), window, attempts.get());
            return new SeriesChunk(window, values);

        } catch (PermanentFetchException e) {
            log.warn("Permanent failure for {}: {}", window, e.getMessage());
            return FetchFailure.of(window, e.getKind(), e.getMessage(), attempts.get());

        } catch (TransientFetchException e) {
            FailureKind kind = Thread.currentThread().isInterrupted() ? FailureKind.TIMEOUT : e.getKind();
            log.warn("Giving up on {} after {} attempt(s): {}", window, attempts.get(), e.getMessage());
            return new FetchFailure(window, kind, true, e.getMessage(), attempts.get());

        } catch (Exception e) {
            log.error("Unexpected failure fetching {}: {}", window, e.getMessage(), e);
            return FetchFailure.of(window, FailureKind.CLIENT_ERROR,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), attempts.get());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<DailyValue> attempt(ChunkWindow window, AtomicInteger attempts) {
        if (!rateLimiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransientFetchException(FailureKind.TIMEOUT, "Interrupted waiting for a request permit");
            }
            throw new TransientFetchException(FailureKind.RATE_LIMITED, "No request permit within the limiter timeout");
        }
        try {
            spacing.awaitTurn();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException(FailureKind.TIMEOUT, "Interrupted waiting for the request interval");
        }
        attempts.incrementAndGet();
        return client.query(window.construct(), window.startDate(), window.endDate());
    }

    private FetchFailure validate(ChunkWindow window) {
        if (window.construct() == null || window.construct().isBlank()) {
            return FetchFailure.of(window, FailureKind.INVALID_CONSTRUCT, "Construct must not be blank", 0);
        }
        if (window.startDate() == null || window.endDate() == null || window.startDate().isAfter(window.endDate())) {
            return FetchFailure.of(window, FailureKind.MALFORMED_WINDOW,
                    "Window start must not be after its end", 0);
        }
        return null;
    }
}
