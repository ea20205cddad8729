package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.FailureKind;
import com.mindtrends.monitor.model.TrendsApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HttpTrendsQueryClient")
class HttpTrendsQueryClientTest {

    private static final LocalDate START = LocalDate.of(2020, 6, 1);
    private static final LocalDate END = LocalDate.of(2020, 6, 3);

    @Mock private RestTemplate restTemplate;

    private HttpTrendsQueryClient client;

    @BeforeEach
    void setUp() {
        TrendsMonitorProperties properties = new TrendsMonitorProperties();
        properties.getApi().setBaseUrl("http://trends.test/api");
        client = new HttpTrendsQueryClient(restTemplate, new TrendsResponseMapper(), properties);
    }

    @Test
    @DisplayName("Builds an encoded query URI and maps the response")
    void queriesAndMaps() {
        when(restTemplate.getForObject(any(URI.class), eq(TrendsApiResponse.class)))
                .thenReturn(response("2020-06-01", 40.0, "2020-06-02", 55.0));

        List<DailyValue> values = client.query("mental health", START, END);

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(TrendsApiResponse.class));
        assertThat(uri.getValue().toString())
                .startsWith("http://trends.test/api/interest")
                .contains("term=mental%20health")
                .contains("start=2020-06-01")
                .contains("end=2020-06-03");
        assertThat(values).containsExactly(
                new DailyValue(START, 40.0), new DailyValue(START.plusDays(1), 55.0));
    }

    @Test
    @DisplayName("Empty response is a transient NO_DATA failure")
    void emptyResponseIsTransient() {
        when(restTemplate.getForObject(any(URI.class), eq(TrendsApiResponse.class)))
                .thenReturn(new TrendsApiResponse());

        assertThatThrownBy(() -> client.query("anxiety", START, END))
                .isInstanceOf(TransientFetchException.class)
                .extracting(e -> ((FetchException) e).getKind())
                .isEqualTo(FailureKind.NO_DATA);
    }

    @Test
    @DisplayName("429 is transient and rate limited")
    void tooManyRequests() {
        stubError(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        assertKind(TransientFetchException.class, FailureKind.RATE_LIMITED);
    }

    @Test
    @DisplayName("404 is a permanent invalid construct")
    void notFound() {
        stubError(HttpClientErrorException.create(HttpStatus.NOT_FOUND, "Not Found",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        assertKind(PermanentFetchException.class, FailureKind.INVALID_CONSTRUCT);
    }

    @Test
    @DisplayName("Other 4xx are permanent client errors")
    void forbidden() {
        stubError(HttpClientErrorException.create(HttpStatus.FORBIDDEN, "Forbidden",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        assertKind(PermanentFetchException.class, FailureKind.CLIENT_ERROR);
    }

    @Test
    @DisplayName("5xx is a transient server error")
    void serverError() {
        stubError(HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        assertKind(TransientFetchException.class, FailureKind.SERVER_ERROR);
    }

    @Test
    @DisplayName("I/O errors are transient network failures")
    void ioError() {
        stubError(new ResourceAccessException("Connection reset"));

        assertKind(TransientFetchException.class, FailureKind.NETWORK);
    }

    private void stubError(RuntimeException error) {
        when(restTemplate.getForObject(any(URI.class), eq(TrendsApiResponse.class))).thenThrow(error);
    }

    private void assertKind(Class<? extends FetchException> type, FailureKind kind) {
        assertThatThrownBy(() -> client.query("anxiety", START, END))
                .isInstanceOf(type)
                .extracting(e -> ((FetchException) e).getKind())
                .isEqualTo(kind);
    }

    private static TrendsApiResponse response(String d1, double v1, String d2, double v2) {
        TrendsApiResponse response = new TrendsApiResponse();
        response.setTerm("mental health");
        response.setPoints(List.of(point(d1, v1, false), point(d2, v2, false)));
        return response;
    }

    static TrendsApiResponse.Point point(String date, Double value, boolean partial) {
        TrendsApiResponse.Point point = new TrendsApiResponse.Point();
        point.setDate(date);
        point.setValue(value);
        point.setPartial(partial);
        return point;
    }
}
