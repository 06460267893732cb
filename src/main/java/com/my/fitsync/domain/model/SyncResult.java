package com.my.fitsync.domain.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 지표 하나, 날짜 하나의 수집 결과를 성공/실패 사유와 함께 남겨 부분 실패를 보고서에 그대로 드러내기 위함.
 */
public record SyncResult(
        String metric,
        LocalDate date,
        ResultStatus status,
        MetricPayload payload,
        FailureReason failureReason,
        String message,
        Duration retryAfter
) {
    public SyncResult {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(status, "status");
        if (status == ResultStatus.SUCCEEDED && payload == null) {
            throw new IllegalArgumentException("성공 결과에는 payload 가 필요합니다.");
        }
        if (status == ResultStatus.FAILED && failureReason == null) {
            throw new IllegalArgumentException("실패 결과에는 사유가 필요합니다.");
        }
    }

    public static SyncResult succeeded(MetricKind kind, LocalDate date, MetricPayload payload) {
        return new SyncResult(kind.name(), date, ResultStatus.SUCCEEDED, payload, null, null, null);
    }

    public static SyncResult skipped(MetricKind kind, LocalDate date) {
        return new SyncResult(kind.name(), date, ResultStatus.SKIPPED, null, null, "이미 저장된 결과가 있어 건너뜁니다.", null);
    }

    public static SyncResult failed(MetricKind kind, LocalDate date, FailureReason reason, String message) {
        return failed(kind, date, reason, message, null);
    }

    public static SyncResult failed(MetricKind kind, LocalDate date, FailureReason reason, String message, Duration retryAfter) {
        return new SyncResult(kind.name(), date, ResultStatus.FAILED, null, reason, message, retryAfter);
    }

    public boolean isSuccess() {
        return status != ResultStatus.FAILED;
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }
}
