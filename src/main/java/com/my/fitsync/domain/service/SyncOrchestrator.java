package com.my.fitsync.domain.service;

import com.my.fitsync.domain.exception.AuthorizationException;
import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.exception.MetricFetchException;
import com.my.fitsync.domain.exception.NotConnectedException;
import com.my.fitsync.domain.exception.StorageException;
import com.my.fitsync.domain.model.AccountKeys;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.FailureReason;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.model.SyncResult;
import com.my.fitsync.domain.model.SyncStatus;
import com.my.fitsync.domain.port.in.SyncUseCase;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.MetricFetchPort;
import com.my.fitsync.domain.port.out.ResultStore;
import com.my.fitsync.domain.port.out.SyncReportPort;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 날짜 창 계산, 지표별 조회, 저장, 부분 실패 집계를 하나의 유스케이스로 묶어 한 지표의 실패가 나머지 지표 수집을 막지 않도록 하기 위함.
 */
public class SyncOrchestrator implements SyncUseCase {

    static final int MAX_BACKFILL_DAYS = 31;

    private final TokenLifecycleManager tokenLifecycleManager;
    private final MetricFetchPort metricFetchPort;
    private final ResultStore resultStore;
    private final SyncReportPort syncReportPort;
    private final ClockPort clockPort;
    private final List<MetricKind> metrics;

    public SyncOrchestrator(TokenLifecycleManager tokenLifecycleManager,
                            MetricFetchPort metricFetchPort,
                            ResultStore resultStore,
                            SyncReportPort syncReportPort,
                            ClockPort clockPort,
                            List<MetricKind> metrics) {
        this.tokenLifecycleManager = tokenLifecycleManager;
        this.metricFetchPort = metricFetchPort;
        this.resultStore = resultStore;
        this.syncReportPort = syncReportPort;
        this.clockPort = clockPort;
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("수집할 지표가 하나 이상 필요합니다.");
        }
        this.metrics = List.copyOf(metrics);
    }

    @Override
    public SyncReport runSync(String accountKey) {
        return runSync(accountKey, null);
    }

    @Override
    public SyncReport runSync(String accountKey, LocalDate targetDate) {
        LocalDate date = targetDate != null ? targetDate : yesterday();
        SyncReport report = sync(AccountKeys.requireValid(accountKey), date, false);
        syncReportPort.publish(report);
        return report;
    }

    @Override
    public List<SyncReport> backfill(String accountKey, LocalDate from, LocalDate to, boolean skipExisting) {
        String key = AccountKeys.requireValid(accountKey);
        if (from == null || to == null) {
            throw new InvalidRequestException("백필 시작/종료 날짜가 필요합니다.");
        }
        if (to.isBefore(from)) {
            throw new InvalidRequestException("종료 날짜가 시작 날짜보다 이를 수 없습니다.");
        }
        if (ChronoUnit.DAYS.between(from, to) >= MAX_BACKFILL_DAYS) {
            throw new InvalidRequestException("백필 기간은 최대 " + MAX_BACKFILL_DAYS + "일입니다.");
        }
        List<SyncReport> reports = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            SyncReport report = sync(key, date, skipExisting);
            syncReportPort.publish(report);
            reports.add(report);
            if (report.status() == SyncStatus.NOT_CONNECTED || report.cancelled()) {
                break;
            }
        }
        return reports;
    }

    private SyncReport sync(String accountKey, LocalDate date, boolean skipExisting) {
        Instant startedAt = now();
        Credential credential;
        try {
            credential = tokenLifecycleManager.validCredential(accountKey);
        } catch (NotConnectedException e) {
            return SyncReport.notConnected(accountKey, date, e.getMessage(), startedAt, now());
        } catch (AuthorizationException e) {
            return SyncReport.credentialUnavailable(accountKey, date, e.getMessage(), startedAt, now());
        } catch (StorageException e) {
            return SyncReport.credentialStoreUnavailable(accountKey, date, e.getMessage(), startedAt, now());
        }

        SyncRun run = new SyncRun(accountKey, date, credential);
        for (MetricKind kind : metrics) {
            if (run.stopReason != null) {
                run.results.add(SyncResult.failed(kind, date, run.stopReason, run.stopMessage));
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                run.stop(FailureReason.CANCELLED, "동기화가 취소되었습니다.");
                run.results.add(SyncResult.failed(kind, date, FailureReason.CANCELLED, run.stopMessage));
                continue;
            }
            if (skipExisting && resultStore.exists(accountKey, kind, date)) {
                run.results.add(SyncResult.skipped(kind, date));
                continue;
            }
            run.results.add(syncMetric(run, kind));
        }
        return SyncReport.completed(
                accountKey,
                run.credential.subjectId(),
                date,
                run.results,
                run.stopReason,
                run.stopMessage,
                run.stopReason == FailureReason.CANCELLED,
                startedAt,
                now()
        );
    }

    private SyncResult syncMetric(SyncRun run, MetricKind kind) {
        MetricPayload payload;
        try {
            payload = fetchWithRevalidation(run, kind);
        } catch (NotConnectedException e) {
            run.stop(FailureReason.NOT_CONNECTED, e.getMessage());
            return SyncResult.failed(kind, run.date, FailureReason.NOT_CONNECTED, e.getMessage());
        } catch (AuthorizationException e) {
            return SyncResult.failed(kind, run.date, FailureReason.AUTH_UNAVAILABLE, e.getMessage());
        } catch (StorageException e) {
            // 401 재검증 중 자격 증명 저장소 오류. 이 지표만 실패로 남긴다
            return SyncResult.failed(kind, run.date, FailureReason.STORAGE, e.getMessage());
        } catch (MetricFetchException e) {
            if (e.reason() == FailureReason.CANCELLED) {
                run.stop(FailureReason.CANCELLED, e.getMessage());
            }
            return SyncResult.failed(kind, run.date, e.reason(), e.getMessage(), e.retryAfter().orElse(null));
        }
        try {
            resultStore.save(run.accountKey, kind, run.date, payload);
        } catch (StorageException e) {
            return SyncResult.failed(kind, run.date, FailureReason.STORAGE, e.getMessage());
        }
        return SyncResult.succeeded(kind, run.date, payload);
    }

    /**
     * 검증과 사용 사이에 토큰이 만료되는 경우를 위해 401 에 한해 재검증 후 정확히 한 번만 다시 시도한다.
     */
    private MetricPayload fetchWithRevalidation(SyncRun run, MetricKind kind) {
        try {
            return metricFetchPort.fetch(kind, run.date, run.credential);
        } catch (MetricFetchException e) {
            if (e.reason() != FailureReason.UNAUTHORIZED) {
                throw e;
            }
            run.credential = tokenLifecycleManager.revalidate(run.accountKey, run.credential);
            return metricFetchPort.fetch(kind, run.date, run.credential);
        }
    }

    private LocalDate yesterday() {
        return clockPort.now().toLocalDate().minusDays(1);
    }

    private Instant now() {
        return clockPort.now().toInstant();
    }

    private static final class SyncRun {
        private final String accountKey;
        private final LocalDate date;
        private final List<SyncResult> results = new ArrayList<>();
        private Credential credential;
        private FailureReason stopReason;
        private String stopMessage;

        private SyncRun(String accountKey, LocalDate date, Credential credential) {
            this.accountKey = accountKey;
            this.date = date;
            this.credential = Objects.requireNonNull(credential);
        }

        private void stop(FailureReason reason, String message) {
            this.stopReason = reason;
            this.stopMessage = message;
        }
    }
}
