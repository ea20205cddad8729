package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.FailureKind;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a fresh {@link RateLimitedFetcher} for each pipeline run.
 *
 * The limiter and the request spacing live exactly as long as the run that created them;
 * two runs never share request permits.
 */
@Component
@RequiredArgsConstructor
public class FetcherFactory {

    private final TrendsQueryClient queryClient;
    private final TrendsMonitorProperties properties;

    public RateLimitedFetcher create(String runId) {
        return new RateLimitedFetcher(queryClient, rateLimiter(runId), spacing(), retry(runId));
    }

    RequestSpacing spacing() {
        return new RequestSpacing(Duration.ofMillis(Math.max(0L, properties.getApi().getRequestIntervalMs())));
    }

    RateLimiter rateLimiter(String runId) {
        TrendsMonitorProperties.Api api = properties.getApi();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMillis(Math.max(1L, api.getRequestIntervalMs())))
                .timeoutDuration(api.getPermitTimeout())
                .build();
        return RateLimiter.of("trends-api-" + runId, config);
    }

    Retry retry(String runId) {
        TrendsMonitorProperties.Api api = properties.getApi();
        long base = Math.max(1L, api.getBackoffBaseMs());
        IntervalFunction backoff = api.getJitterFactor() > 0.0
                ? IntervalFunction.ofExponentialRandomBackoff(base, api.getBackoffMultiplier(),
                        Math.min(api.getJitterFactor(), 0.99))
                : IntervalFunction.ofExponentialBackoff(base, api.getBackoffMultiplier());

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, api.getMaxAttempts()))
                .intervalFunction(backoff)
                .retryOnException(FetcherFactory::isRetriable)
                .build();
        return Retry.of("trends-api-" + runId, config);
    }

    private static boolean isRetriable(Throwable error) {
        return error instanceof TransientFetchException
                && ((TransientFetchException) error).getKind() != FailureKind.TIMEOUT;
    }
}
