package com.my.fitsync.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncReportTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);
    private static final Instant NOW = Instant.parse("2026-03-10T00:00:00Z");

    @Test
    void allSuccessfulOrSkippedIsSucceeded() {
        SyncReport report = completed(List.of(
                SyncResult.succeeded(MetricKind.STEPS, DATE, MetricPayload.of("{}")),
                SyncResult.skipped(MetricKind.SLEEP, DATE)), null);

        assertThat(report.status()).isEqualTo(SyncStatus.SUCCEEDED);
        assertThat(report.failedMetrics()).isEmpty();
    }

    @Test
    void mixedResultsArePartial() {
        SyncReport report = completed(List.of(
                SyncResult.succeeded(MetricKind.STEPS, DATE, MetricPayload.empty()),
                SyncResult.failed(MetricKind.HEART_RATE_INTRADAY, DATE, FailureReason.TRANSPORT, "timeout")), null);

        assertThat(report.status()).isEqualTo(SyncStatus.PARTIAL);
        assertThat(report.failedMetrics()).containsExactly("heartrate-intraday");
    }

    @Test
    void noSuccessIsFailedUnlessCredentialWentAway() {
        List<SyncResult> failures = List.of(
                SyncResult.failed(MetricKind.STEPS, DATE, FailureReason.NOT_CONNECTED, "gone"));

        assertThat(completed(failures, FailureReason.NOT_CONNECTED).status()).isEqualTo(SyncStatus.NOT_CONNECTED);
        assertThat(completed(failures, null).status()).isEqualTo(SyncStatus.FAILED);
    }

    private static SyncReport completed(List<SyncResult> results, FailureReason failure) {
        return SyncReport.completed("default", "ABC", DATE, results, failure, null, false, NOW, NOW);
    }
}
