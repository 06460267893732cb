package com.my.fitsync.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    FitbitConfig fitbit();

    SyncConfig sync();

    PathsConfig paths();

    CredentialConfig credential();

    interface FitbitConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("authorization-uri")
        @WithDefault("https://www.fitbit.com/oauth2/authorize")
        String authorizationUri();

        @WithName("token-uri")
        @WithDefault("https://api.fitbit.com/oauth2/token")
        String tokenUri();

        @WithName("api-base-uri")
        @WithDefault("https://api.fitbit.com")
        String apiBaseUri();

        @WithName("redirect-uri")
        @WithDefault("http://localhost:8080/fitbit/callback")
        String redirectUri();

        @WithDefault("activity,heartrate,sleep,weight,profile")
        List<String> scopes();

        @WithName("request-timeout-seconds")
        @WithDefault("20")
        int requestTimeoutSeconds();

        @WithName("refresh-margin-seconds")
        @WithDefault("60")
        int refreshMarginSeconds();
    }

    interface SyncConfig {
        @WithName("account-key")
        @WithDefault("default")
        String accountKey();

        @WithDefault("steps,heartrate-intraday")
        List<String> metrics();

        @WithDefault("Asia/Seoul")
        String zone();

        ScheduleConfig schedule();
    }

    interface ScheduleConfig {
        @WithDefault("false")
        boolean enabled();

        @WithName("initial-delay-minutes")
        @WithDefault("5")
        int initialDelayMinutes();

        @WithName("interval-hours")
        @WithDefault("24")
        int intervalHours();
    }

    interface PathsConfig {
        @WithName("data-path")
        @WithDefault("./data/fitbit")
        String dataPath();
    }

    interface CredentialConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/credentials.db")
        String sqlitePath();
    }
}
