package com.my.fitsync.adapter.out.fitbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.MetricFetchException;
import com.my.fitsync.domain.exception.TransientFetchException;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.FailureReason;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import com.my.fitsync.domain.model.MetricType;
import com.my.fitsync.domain.port.out.MetricFetchPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * 왜: Fitbit Web API 호출을 캡슐화하고 HTTP 상태 코드를 도메인 실패 사유로 바꿔, 오케스트레이터가 지표별로 대응할 수 있게 하기 위함.
 */
@ApplicationScoped
public class FitbitMetricClient implements MetricFetchPort {

    private static final Logger log = Logger.getLogger(FitbitMetricClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final Duration requestTimeout;

    @Inject
    public FitbitMetricClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(appConfig.fitbit().requestTimeoutSeconds()))
                        .build(),
                objectMapper,
                appConfig.fitbit().apiBaseUri(),
                Duration.ofSeconds(appConfig.fitbit().requestTimeoutSeconds()));
    }

    FitbitMetricClient(HttpClient httpClient, ObjectMapper objectMapper, String apiBase, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.requestTimeout = requestTimeout;
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, jitter = 200, retryOn = TransientFetchException.class)
    public MetricPayload fetch(MetricKind kind, LocalDate date, Credential credential) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + kind.pathFor(date)))
                .header("Authorization", "Bearer " + credential.accessToken())
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricFetchException(FailureReason.CANCELLED, "지표 조회가 중단되었습니다: " + kind.name(), null, e);
        } catch (IOException e) {
            log.warnf("Fitbit 지표 조회 통신 실패 metric=%s date=%s: %s", kind.name(), date, e.getMessage());
            throw new TransientFetchException("지표 조회 통신 실패: " + kind.name() + " (" + e.getMessage() + ")", e);
        }
        return toPayload(kind, date, response);
    }

    private MetricPayload toPayload(MetricKind kind, LocalDate date, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 200) {
            return MetricPayload.of(prettyPrint(kind, response.body()));
        }
        if (status == 404) {
            log.infof("Fitbit 에 데이터가 없습니다 metric=%s date=%s", kind.name(), date);
            return MetricPayload.empty();
        }
        if (status == 401) {
            throw new MetricFetchException(FailureReason.UNAUTHORIZED, "Fitbit 이 access token 을 거부했습니다: " + kind.name());
        }
        if (status == 429) {
            Duration retryAfter = retryAfter(response);
            log.warnf("Fitbit 호출 제한 metric=%s retryAfter=%s", kind.name(), retryAfter);
            throw new MetricFetchException(FailureReason.RATE_LIMITED,
                    "Fitbit 호출 한도를 초과했습니다: " + kind.name(), retryAfter, null);
        }
        if (status == 400 || status == 403) {
            // 재시도해도 같은 결과다. 주로 앱 권한 설정 문제다
            log.warnf("Fitbit 이 지표 조회를 거부했습니다 metric=%s date=%s status=%d", kind.name(), date, status);
            throw new MetricFetchException(FailureReason.FORBIDDEN, forbiddenMessage(kind, status));
        }
        log.warnf("Fitbit 지표 조회 실패 metric=%s date=%s status=%d", kind.name(), date, status);
        throw new TransientFetchException("지표 조회 실패 status=" + status + ": " + kind.name());
    }

    private static String forbiddenMessage(MetricKind kind, int status) {
        String message = "Fitbit 이 " + kind.name() + " 조회를 거부했습니다(status=" + status + "). "
                + "OAuth 범위에 '" + requiredScope(kind) + "' 가 있는지 확인하세요.";
        if (kind.type() == MetricType.INTRADAY) {
            message += " 분 단위(intraday) 데이터는 Fitbit 앱 설정에서 intraday 접근이 허용되어야 합니다"
                    + "(앱 유형 Personal, 또는 Server 앱의 별도 승인).";
        }
        return message;
    }

    private static String requiredScope(MetricKind kind) {
        String path = kind.resourcePath();
        if (path.contains("/activities/heart/")) {
            return "heartrate";
        }
        if (path.contains("/sleep/")) {
            return "sleep";
        }
        return "activity";
    }

    private String prettyPrint(MetricKind kind, String body) {
        try {
            JsonNode node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new MetricFetchException(FailureReason.MALFORMED_RESPONSE, "응답 본문이 비어 있습니다: " + kind.name());
            }
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MetricFetchException(FailureReason.MALFORMED_RESPONSE,
                    "응답이 올바른 JSON 이 아닙니다: " + kind.name(), null, e);
        }
    }

    /**
     * Retry-After 가 없으면 Fitbit 전용 Fitbit-Rate-Limit-Reset 헤더(초)를 쓴다.
     */
    private Duration retryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
                .or(() -> response.headers().firstValue("Fitbit-Rate-Limit-Reset"))
                .map(String::trim)
                .flatMap(value -> {
                    try {
                        return Optional.of(Duration.of(Long.parseLong(value), ChronoUnit.SECONDS));
                    } catch (NumberFormatException e) {
                        log.warnf("Retry-After 헤더를 해석할 수 없습니다: %s", value);
                        return Optional.empty();
                    }
                })
                .orElse(null);
    }
}
