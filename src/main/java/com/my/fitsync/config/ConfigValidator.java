package com.my.fitsync.config;

import com.my.fitsync.domain.model.MetricKind;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.net.URI;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("FITBIT_CLIENT_ID", appConfig.fitbit().clientId().orElse(null), isProd);
        validateRequired("FITBIT_CLIENT_SECRET", appConfig.fitbit().clientSecret().orElse(null), isProd);
        URI.create(appConfig.fitbit().redirectUri());
        ZoneId.of(appConfig.sync().zone());
        // 알 수 없는 지표 이름은 기동 시점에 실패시킨다
        MetricKind.resolve(appConfig.sync().metrics());
        if (appConfig.fitbit().requestTimeoutSeconds() <= 0) {
            throw new IllegalStateException("요청 타임아웃은 0보다 커야 합니다: " + appConfig.fitbit().requestTimeoutSeconds());
        }
        if (appConfig.sync().schedule().enabled() && appConfig.sync().schedule().intervalHours() <= 0) {
            throw new IllegalStateException("동기화 주기는 0보다 커야 합니다: " + appConfig.sync().schedule().intervalHours());
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }
}
