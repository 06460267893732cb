package com.my.fitsync.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 한 번의 동기화 호출 결과를 예외 대신 구조화된 보고서로 돌려주어 호출자가 지표별 성공/실패를 그대로 안내할 수 있게 하기 위함.
 */
public record SyncReport(
        String accountKey,
        String subjectId,
        LocalDate date,
        SyncStatus status,
        List<SyncResult> results,
        FailureReason failure,
        String failureMessage,
        boolean cancelled,
        Instant startedAt,
        Instant finishedAt
) {
    public SyncReport {
        Objects.requireNonNull(accountKey, "accountKey");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(status, "status");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static SyncReport notConnected(String accountKey, LocalDate date, String message, Instant startedAt, Instant finishedAt) {
        return new SyncReport(accountKey, null, date, SyncStatus.NOT_CONNECTED, List.of(),
                FailureReason.NOT_CONNECTED, message, false, startedAt, finishedAt);
    }

    public static SyncReport credentialUnavailable(String accountKey, LocalDate date, String message, Instant startedAt, Instant finishedAt) {
        return new SyncReport(accountKey, null, date, SyncStatus.FAILED, List.of(),
                FailureReason.AUTH_UNAVAILABLE, message, false, startedAt, finishedAt);
    }

    public static SyncReport credentialStoreUnavailable(String accountKey, LocalDate date, String message, Instant startedAt, Instant finishedAt) {
        return new SyncReport(accountKey, null, date, SyncStatus.FAILED, List.of(),
                FailureReason.STORAGE, message, false, startedAt, finishedAt);
    }

    /**
     * 지표별 결과로부터 전체 상태를 계산한다. 모든 지표가 성공해야 SUCCEEDED 이다.
     */
    public static SyncReport completed(String accountKey,
                                       String subjectId,
                                       LocalDate date,
                                       List<SyncResult> results,
                                       FailureReason failure,
                                       String failureMessage,
                                       boolean cancelled,
                                       Instant startedAt,
                                       Instant finishedAt) {
        long successes = results.stream().filter(SyncResult::isSuccess).count();
        SyncStatus status;
        if (!results.isEmpty() && successes == results.size()) {
            status = SyncStatus.SUCCEEDED;
        } else if (successes > 0) {
            status = SyncStatus.PARTIAL;
        } else if (failure == FailureReason.NOT_CONNECTED) {
            status = SyncStatus.NOT_CONNECTED;
        } else {
            status = SyncStatus.FAILED;
        }
        return new SyncReport(accountKey, subjectId, date, status, results, failure, failureMessage, cancelled, startedAt, finishedAt);
    }

    public boolean succeeded() {
        return status == SyncStatus.SUCCEEDED;
    }

    public List<SyncResult> failedResults() {
        return results.stream()
                .filter(result -> !result.isSuccess())
                .toList();
    }

    public List<String> failedMetrics() {
        return failedResults().stream()
                .map(SyncResult::metric)
                .toList();
    }
}
