package com.my.fitsync.adapter.in.scheduler;

import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.port.in.SyncUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 사람이 요청하지 않아도 기본 계정의 어제 데이터를 주기적으로 수집하기 위한 작업 스케줄러가 필요하기 때문.
 */
@Startup
@ApplicationScoped
public class ScheduledSyncPoller {

    private static final Logger log = Logger.getLogger(ScheduledSyncPoller.class);

    private final SyncUseCase syncUseCase;
    private final String accountKey;
    private final boolean enabled;
    private final long initialDelayMinutes;
    private final long intervalMinutes;
    private ScheduledExecutorService executor;

    @Inject
    public ScheduledSyncPoller(SyncUseCase syncUseCase, AppConfig appConfig) {
        this.syncUseCase = syncUseCase;
        this.accountKey = appConfig.sync().accountKey();
        this.enabled = appConfig.sync().schedule().enabled();
        this.initialDelayMinutes = appConfig.sync().schedule().initialDelayMinutes();
        this.intervalMinutes = TimeUnit.HOURS.toMinutes(appConfig.sync().schedule().intervalHours());
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("주기 동기화가 비활성화되어 있습니다.");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "fitbit-sync-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::syncSafely, initialDelayMinutes, intervalMinutes, TimeUnit.MINUTES);
        log.infof("주기 동기화 시작: account=%s initialDelay=%dm interval=%dm", accountKey, initialDelayMinutes, intervalMinutes);
    }

    void syncSafely() {
        MDC.put("correlationId", "scheduled-" + UUID.randomUUID());
        MDC.put("accountKey", accountKey);
        try {
            SyncReport report = syncUseCase.runSync(accountKey);
            log.infof("주기 동기화 완료: date=%s status=%s failed=%s", report.date(), report.status(), report.failedMetrics());
        } catch (Exception e) {
            // 예외가 빠져나가면 이후 실행이 모두 취소된다
            log.warnf(e, "주기 동기화 중 예외: %s", e.getMessage());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("accountKey");
        }
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
