package com.my.fitsync.adapter.out.reply;

import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.model.SyncResult;

import java.util.List;

/**
 * 큐로 내보내는 보고서 형태. 지표 본문은 싣지 않는다.
 */
public record SyncReportMessage(String accountKey,
                                String subjectId,
                                String date,
                                String status,
                                String failure,
                                String failureMessage,
                                boolean cancelled,
                                String startedAt,
                                String finishedAt,
                                List<MetricOutcome> results) {

    public static SyncReportMessage from(SyncReport report) {
        return new SyncReportMessage(
                report.accountKey(),
                report.subjectId(),
                report.date().toString(),
                report.status().name(),
                report.failure() == null ? null : report.failure().name(),
                report.failureMessage(),
                report.cancelled(),
                report.startedAt() == null ? null : report.startedAt().toString(),
                report.finishedAt() == null ? null : report.finishedAt().toString(),
                report.results().stream().map(MetricOutcome::from).toList()
        );
    }

    public record MetricOutcome(String metric,
                                String status,
                                boolean noData,
                                String failureReason,
                                String message,
                                Long retryAfterSeconds) {

        static MetricOutcome from(SyncResult result) {
            return new MetricOutcome(
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
