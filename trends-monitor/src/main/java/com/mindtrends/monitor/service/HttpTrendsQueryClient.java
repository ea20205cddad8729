package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.ChunkWindow;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.FailureKind;
import com.mindtrends.monitor.model.TrendsApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;

/**
 * Thin client over the interest-over-time REST endpoint.
 *
 * Pacing and retries are not handled here: every call is exactly one request, and
 * failures are classified so {@link RateLimitedFetcher} knows whether to back off and
 * try again. 429, 5xx and I/O errors are transient; any other 4xx is permanent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpTrendsQueryClient implements TrendsQueryClient {

    private final RestTemplate restTemplate;
    private final TrendsResponseMapper mapper;
    private final TrendsMonitorProperties properties;

    @Override
    public List<DailyValue> query(String construct, LocalDate start, LocalDate end) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/interest")
                .queryParam("term", construct)
                .queryParam("start", start)
                .queryParam("end", end)
                .build()
                .encode()
                .toUri();

        log.debug("Calling trends API: {}", uri);
        TrendsApiResponse response = callApi(uri);

        List<DailyValue> values = mapper.map(response, new ChunkWindow(construct, start, end));
        if (values.isEmpty()) {
            throw new TransientFetchException(FailureKind.NO_DATA,
                    "No usable data returned for " + construct + " " + start + ".." + end);
        }
        log.debug("API returned {} daily values for {} {}..{}", values.size(), construct, start, end);
        return values;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private TrendsApiResponse callApi(URI uri) {
        try {
            return restTemplate.getForObject(uri, TrendsApiResponse.class);

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by trends API");
            throw new TransientFetchException(FailureKind.RATE_LIMITED, "HTTP 429 for " + uri, e);

        } catch (HttpClientErrorException.NotFound e) {
            throw new PermanentFetchException(FailureKind.INVALID_CONSTRUCT, "HTTP 404 for " + uri, e);

        } catch (HttpClientErrorException.BadRequest e) {
            throw new PermanentFetchException(FailureKind.MALFORMED_WINDOW, "HTTP 400 for " + uri, e);

        } catch (HttpClientErrorException e) {
            throw new PermanentFetchException(FailureKind.CLIENT_ERROR,
                    "HTTP " + e.getStatusCode().value() + " for " + uri, e);

        } catch (HttpServerErrorException e) {
            throw new TransientFetchException(FailureKind.SERVER_ERROR,
                    "HTTP " + e.getStatusCode().value() + " for " + uri, e);

        } catch (ResourceAccessException e) {
            throw new TransientFetchException(FailureKind.NETWORK, "I/O error calling " + uri + ": " + e.getMessage(), e);

        } catch (RestClientException e) {
            log.error("Unexpected trends API failure for {}: {}", uri, e.getMessage());
            throw new TransientFetchException(FailureKind.NETWORK, e.getMessage(), e);
        }
    }
}
