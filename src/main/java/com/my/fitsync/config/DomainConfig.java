package com.my.fitsync.config;

import com.my.fitsync.adapter.out.clock.ZonedClockAdapter;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.port.in.ConnectAccountUseCase;
import com.my.fitsync.domain.port.in.SyncUseCase;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.CredentialStore;
import com.my.fitsync.domain.port.out.MetricFetchPort;
import com.my.fitsync.domain.port.out.OAuthPort;
import com.my.fitsync.domain.port.out.ResultStore;
import com.my.fitsync.domain.port.out.SyncReportPort;
import com.my.fitsync.domain.service.AccountConnectionService;
import com.my.fitsync.domain.service.SyncOrchestrator;
import com.my.fitsync.domain.service.TokenLifecycleManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하고, 설정 값은 여기서만 도메인에 전달하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public TokenLifecycleManager tokenLifecycleManager(CredentialStore credentialStore,
                                                       OAuthPort oAuthPort,
                                                       ClockPort clockPort,
                                                       AppConfig appConfig) {
        Duration margin = Duration.ofSeconds(appConfig.fitbit().refreshMarginSeconds());
        return new TokenLifecycleManager(credentialStore, oAuthPort, clockPort, margin);
    }

    @Produces
    @ApplicationScoped
    public SyncUseCase syncUseCase(TokenLifecycleManager tokenLifecycleManager,
                                   MetricFetchPort metricFetchPort,
                                   ResultStore resultStore,
                                   SyncReportPort syncReportPort,
                                   ClockPort clockPort,
                                   AppConfig appConfig) {
        return new SyncOrchestrator(
                tokenLifecycleManager,
                metricFetchPort,
                resultStore,
                syncReportPort,
                clockPort,
                MetricKind.resolve(appConfig.sync().metrics())
        );
    }

    @Produces
    @ApplicationScoped
    public ConnectAccountUseCase connectAccountUseCase(OAuthPort oAuthPort,
                                                       TokenLifecycleManager tokenLifecycleManager,
                                                       CredentialStore credentialStore,
                                                       ClockPort clockPort,
                                                       AppConfig appConfig) {
        return new AccountConnectionService(oAuthPort, tokenLifecycleManager, credentialStore, clockPort,
                appConfig.fitbit().redirectUri());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return ZonedClockAdapter.of(ZoneId.of(appConfig.sync().zone()));
    }
}
