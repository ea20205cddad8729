package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.FailureKind;
import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DailyValue;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FetcherFactory")
class FetcherFactoryTest {

    @Mock private TrendsQueryClient client;

    @Test
    @DisplayName("Limiter hands out one permit per request interval")
    void limiterFromProperties() {
        TrendsMonitorProperties properties = new TrendsMonitorProperties();
        properties.getApi().setRequestIntervalMs(2500);
        properties.getApi().setPermitTimeout(Duration.ofSeconds(30));

        RateLimiter limiter = new FetcherFactory(client, properties).rateLimiter("run-1");

        assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(1);
        assertThat(limiter.getRateLimiterConfig().getLimitRefreshPeriod()).isEqualTo(Duration.ofMillis(2500));
        assertThat(limiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Retry retries transient failures except timeouts")
    void retryPredicate() {
        TrendsMonitorProperties properties = new TrendsMonitorProperties();
        properties.getApi().setMaxAttempts(4);

        Retry retry = new FetcherFactory(client, properties).retry("run-1");
        Predicate<Throwable> retriable = retry.getRetryConfig().getExceptionPredicate();

        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(4);
        assertThat(retriable.test(new TransientFetchException(FailureKind.NETWORK, "reset"))).isTrue();
        assertThat(retriable.test(new TransientFetchException(FailureKind.TIMEOUT, "interrupted"))).isFalse();
        assertThat(retriable.test(new PermanentFetchException(FailureKind.CLIENT_ERROR, "403"))).isFalse();
    }

    @Test
    @DisplayName("Each run gets its own limiter")
    void freshLimiterPerRun() {
        FetcherFactory factory = new FetcherFactory(client, new TrendsMonitorProperties());

        assertThat(factory.rateLimiter("a")).isNotSameAs(factory.rateLimiter("b"));
        assertThat(factory.create("a")).isNotNull();
    }

    @Test
    @DisplayName("Requests after an idle pause are still spaced by the full interval")
    void consecutiveRequestsSpacedAfterIdlePause() throws InterruptedException {
        TrendsMonitorProperties properties = new TrendsMonitorProperties();
        properties.getApi().setRequestIntervalMs(300);
        LocalDate day = LocalDate.of(2020, 1, 1);
        ChunkWindow window = new ChunkWindow("anxiety", day, day.plusDays(1));

        List<Long> requestTimes = new ArrayList<>();
        when(client.query(anyString(), any(), any())).thenAnswer(invocation -> {
            requestTimes.add(System.nanoTime());
            return List.of(new DailyValue(day, 40.0));
        });

        RateLimitedFetcher fetcher = new FetcherFactory(client, properties).create("run-1");
        fetcher.fetch(window);
        // Lands the next request late in a limiter refresh period
        Thread.sleep(580);
        fetcher.fetch(window);
        fetcher.fetch(window);

        assertThat(requestTimes).hasSize(3);
        long gapMs = TimeUnit.NANOSECONDS.toMillis(requestTimes.get(2) - requestTimes.get(1));
        assertThat(gapMs).isGreaterThanOrEqualTo(290);
    }

    @Test
    @DisplayName("Spacing interval follows the request interval")
    void spacingFromProperties() {
        TrendsMonitorProperties properties = new TrendsMonitorProperties();
        properties.getApi().setRequestIntervalMs(2500);

        assertThat(new FetcherFactory(client, properties).spacing().getInterval()).isEqualTo(Duration.ofMillis(2500));
    }
}
