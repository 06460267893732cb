package com.my.fitsync.adapter.out.health;

import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.port.out.CredentialStore;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 결과 디렉터리에 쓸 수 없으면 동기화가 모두 STORAGE 실패로 끝나므로 준비 상태에서 미리 드러내기 위함.
 * 계정 연결 여부는 참고 정보로만 싣는다. 연결 전이어도 인증 엔드포인트는 동작해야 한다.
 */
@Readiness
@ApplicationScoped
public class SyncReadinessCheck implements HealthCheck {

    private static final Logger log = Logger.getLogger(SyncReadinessCheck.class);

    private final AppConfig appConfig;
    private final CredentialStore credentialStore;

    public SyncReadinessCheck(AppConfig appConfig, CredentialStore credentialStore) {
        this.appConfig = appConfig;
        this.credentialStore = credentialStore;
    }

    @Override
    public HealthCheckResponse call() {
        Path dataPath = Path.of(appConfig.paths().dataPath());
        boolean writable = ensureWritable(dataPath);
        String accountKey = appConfig.sync().accountKey();
        boolean connected;
        try {
            connected = credentialStore.get(accountKey).isPresent();
        } catch (RuntimeException e) {
            log.warnf("자격 증명 저장소 확인 실패: %s", e.getMessage());
            return HealthCheckResponse.named("fitbit-sync-readiness")
                    .withData("dataPath", dataPath.toString())
                    .withData("credentialStore", e.getMessage())
                    .down()
                    .build();
        }
        return HealthCheckResponse.named("fitbit-sync-readiness")
                .withData("dataPath", dataPath.toString())
                .withData("dataPathWritable", writable)
                .withData("accountKey", accountKey)
                .withData("connected", connected)
                .status(writable)
                .build();
    }

    private static boolean ensureWritable(Path dataPath) {
        try {
            Files.createDirectories(dataPath);
        } catch (IOException e) {
            return false;
        }
        return Files.isWritable(dataPath);
    }
}
