package com.my.fitsync.adapter.out.fitbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.fitsync.domain.exception.MetricFetchException;
import com.my.fitsync.domain.exception.TransientFetchException;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.FailureReason;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class FitbitMetricClientTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);
    private static final Instant T = Instant.parse("2026-03-09T15:00:00Z");
    private static final Credential CREDENTIAL = new Credential("default", "ABC", "access-1", "refresh-1",
            T.plusSeconds(3600), Set.of(), "Bearer", T, T);

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private FitbitMetricClient client;

    @BeforeEach
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = (HttpResponse<String>) mock(HttpResponse.class);
        when(response.headers()).thenReturn(HttpHeaders.of(Map.of(), (name, value) -> true));
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        client = new FitbitMetricClient(httpClient, new ObjectMapper(), "https://api.fitbit.com/", Duration.ofSeconds(5));
    }

    @Test
    void fetchesWithBearerTokenAndPrettyPrintsBody() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"activities-steps\":[{\"dateTime\":\"2026-03-09\",\"value\":\"8231\"}]}");

        MetricPayload payload = client.fetch(MetricKind.STEPS, DATE, CREDENTIAL);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertThat(request.uri().toString())
                .isEqualTo("https://api.fitbit.com/1/user/-/activities/steps/date/2026-03-09/1d.json");
        assertThat(request.headers().firstValue("Authorization")).contains("Bearer access-1");
        assertThat(request.timeout()).contains(Duration.ofSeconds(5));
        assertThat(payload.noData()).isFalse();
        assertThat(payload.json()).contains("\"value\" : \"8231\"").contains(System.lineSeparator());
    }

    @Test
    void notFoundIsNoData() {
        when(response.statusCode()).thenReturn(404);

        MetricPayload payload = client.fetch(MetricKind.SLEEP, DATE, CREDENTIAL);

        assertThat(payload.noData()).isTrue();
        assertThat(payload.json()).isEqualTo("{}");
    }

    @Test
    void unauthorizedIsReportedForRevalidation() {
        when(response.statusCode()).thenReturn(401);

        assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                .isInstanceOf(MetricFetchException.class)
                .extracting(e -> ((MetricFetchException) e).reason())
                .isEqualTo(FailureReason.UNAUTHORIZED);
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        when(response.statusCode()).thenReturn(429);
        when(response.headers()).thenReturn(HttpHeaders.of(Map.of("Retry-After", List.of("42")), (name, value) -> true));

        assertThatThrownBy(() -> client.fetch(MetricKind.HEART_RATE_INTRADAY, DATE, CREDENTIAL))
                .isInstanceOf(MetricFetchException.class)
                .satisfies(e -> {
                    MetricFetchException failure = (MetricFetchException) e;
                    assertThat(failure.reason()).isEqualTo(FailureReason.RATE_LIMITED);
                    assertThat(failure.retryAfter()).contains(Duration.ofSeconds(42));
                });
    }

    @Test
    void serverErrorIsTransient() {
        when(response.statusCode()).thenReturn(503);

        assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                .isInstanceOf(TransientFetchException.class);
    }

    @Test
    void forbiddenIntradayNamesScopeAndIntradayAccessWithoutRetry() {
        when(response.statusCode()).thenReturn(403);

        assertThatThrownBy(() -> client.fetch(MetricKind.HEART_RATE_INTRADAY, DATE, CREDENTIAL))
                .isInstanceOf(MetricFetchException.class)
                .isNotInstanceOf(TransientFetchException.class)
                .hasMessageContaining("heartrate")
                .hasMessageContaining("intraday")
                .extracting(e -> ((MetricFetchException) e).reason())
                .isEqualTo(FailureReason.FORBIDDEN);
    }

    @Test
    void badRequestIsForbiddenNotTransient() {
        when(response.statusCode()).thenReturn(400);

        assertThatThrownBy(() -> client.fetch(MetricKind.SLEEP, DATE, CREDENTIAL))
                .isNotInstanceOf(TransientFetchException.class)
                .hasMessageContaining("sleep")
                .extracting(e -> ((MetricFetchException) e).reason())
                .isEqualTo(FailureReason.FORBIDDEN);
    }

    @Test
    void trailingGarbageAfterJsonIsMalformed() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"activities-steps\":[]} garbage");

        assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                .isInstanceOf(MetricFetchException.class)
                .extracting(e -> ((MetricFetchException) e).reason())
                .isEqualTo(FailureReason.MALFORMED_RESPONSE);
    }

    @Test
    void malformedBodyIsRejected() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("<html>maintenance</html>");

        assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                .isInstanceOf(MetricFetchException.class)
                .extracting(e -> ((MetricFetchException) e).reason())
                .isEqualTo(FailureReason.MALFORMED_RESPONSE);
    }

    @Test
    void ioFailureIsTransient() throws Exception {
        doThrow(new IOException("timeout")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                .isInstanceOf(TransientFetchException.class);
    }

    @Test
    void interruptionIsCancellation() throws Exception {
        doThrow(new InterruptedException()).when(httpClient).send(any(HttpRequest.class), any());

        try {
            assertThatThrownBy(() -> client.fetch(MetricKind.STEPS, DATE, CREDENTIAL))
                    .isInstanceOf(MetricFetchException.class)
                    .extracting(e -> ((MetricFetchException) e).reason())
                    .isEqualTo(FailureReason.CANCELLED);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
