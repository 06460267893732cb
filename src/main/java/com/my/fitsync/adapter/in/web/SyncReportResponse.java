package com.my.fitsync.adapter.in.web;

import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.model.SyncResult;
import com.my.fitsync.domain.model.SyncStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 동기화 보고서의 HTTP 표현. 토큰과 지표 본문은 내보내지 않는다.
 */
public record SyncReportResponse(String accountKey,
                                 String subjectId,
                                 LocalDate date,
                                 SyncStatus status,
                                 String failure,
                                 String failureMessage,
                                 boolean cancelled,
                                 Instant startedAt,
                                 Instant finishedAt,
                                 List<String> failedMetrics,
                                 List<MetricResult> results) {

    public static SyncReportResponse from(SyncReport report) {
        return new SyncReportResponse(
                report.accountKey(),
                report.subjectId(),
                report.date(),
                report.status(),
                report.failure() == null ? null : report.failure().name(),
                report.failureMessage(),
                report.cancelled(),
                report.startedAt(),
                report.finishedAt(),
                report.failedMetrics(),
                report.results().stream().map(MetricResult::from).toList()
        );
    }

    /**
     * 200 SUCCEEDED, 207 PARTIAL, 409 NOT_CONNECTED, 502 FAILED.
     */
    public int httpStatus() {
        return switch (status) {
            case SUCCEEDED -> 200;
            case PARTIAL -> 207;
            case NOT_CONNECTED -> 409;
            case FAILED -> 502;
        };
    }

    public record MetricResult(String metric,
                               String status,
                               boolean noData,
                               String failureReason,
                               String message,
                               Long retryAfterSeconds) {

        static MetricResult from(SyncResult result) {
            return new MetricResult(
                    result.metric(),
                    result.status().name(),
                    result.payload() != null && result.payload().noData(),
                    result.failureReason() == null ? null : result.failureReason().name(),
                    result.message(),
                    result.retryAfterHint().map(duration -> duration.toSeconds()).orElse(null)
            );
        }
    }
}
