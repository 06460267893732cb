package com.my.fitsync.adapter.out.oauth;

import com.google.api.client.auth.oauth2.AuthorizationCodeRequestUrl;
import com.google.api.client.auth.oauth2.AuthorizationCodeTokenRequest;
import com.google.api.client.auth.oauth2.RefreshTokenRequest;
import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenRequest;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.http.BasicAuthentication;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.AuthorizationException;
import com.my.fitsync.domain.model.TokenGrant;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.OAuthPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 왜: Fitbit 토큰 엔드포인트 호출(코드 교환, 토큰 갱신)을 OAuth 클라이언트 라이브러리로 감싸고,
 * 실패를 재인증이 필요한 영구 오류와 재시도 가능한 일시 오류로 나누어 도메인에 전달하기 위함.
 */
@ApplicationScoped
public class FitbitOAuthClient implements OAuthPort {

    private static final Logger log = Logger.getLogger(FitbitOAuthClient.class);

    /**
     * refresh token 자체가 폐기되었거나 무효하다는 응답만 영구 오류로 본다.
     * invalid_client 같은 앱 설정 오류는 설정을 고치면 같은 refresh token 으로 회복되므로 여기 넣지 않는다.
     */
    private static final Set<String> TERMINAL_ERRORS = Set.of("invalid_grant", "invalid_token", "expired_token");

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final AppConfig.FitbitConfig fitbitConfig;
    private final ClockPort clockPort;

    @Inject
    public FitbitOAuthClient(AppConfig appConfig, ClockPort clockPort) {
        this(appConfig.fitbit(), new NetHttpTransport(), clockPort);
    }

    FitbitOAuthClient(AppConfig.FitbitConfig fitbitConfig, HttpTransport httpTransport, ClockPort clockPort) {
        this.fitbitConfig = fitbitConfig;
        this.httpTransport = httpTransport;
        this.jsonFactory = JacksonFactory.getDefaultInstance();
        this.clockPort = clockPort;
    }

    @Override
    public URI authorizationUri(String state, String redirectUri) {
        String url = new AuthorizationCodeRequestUrl(fitbitConfig.authorizationUri(), clientId())
                .setRedirectUri(redirectUri)
                .setScopes(fitbitConfig.scopes())
                .setState(state)
                .build();
        return URI.create(url);
    }

    @Override
    public TokenGrant exchangeCode(String authorizationCode, String redirectUri) {
        AuthorizationCodeTokenRequest request = new AuthorizationCodeTokenRequest(
                httpTransport, jsonFactory, new GenericUrl(fitbitConfig.tokenUri()), authorizationCode)
                .setRedirectUri(redirectUri)
                .setClientAuthentication(clientAuthentication())
                .setRequestInitializer(timeouts());
        TokenGrant grant = execute(request, "인가 코드 교환");
        if (grant.refreshToken() == null) {
            throw AuthorizationException.terminal("코드 교환 응답에 refresh token 이 없습니다.", null);
        }
        log.infof("Fitbit 인가 코드 교환 완료: user=%s scopes=%s", grant.subjectId(), grant.scopes());
        return grant;
    }

    @Override
    public TokenGrant refresh(String refreshToken) {
        RefreshTokenRequest request = new RefreshTokenRequest(
                httpTransport, jsonFactory, new GenericUrl(fitbitConfig.tokenUri()), refreshToken)
                .setClientAuthentication(clientAuthentication())
                .setRequestInitializer(timeouts());
        TokenGrant grant = execute(request, "토큰 갱신");
        log.infof("Fitbit 토큰 갱신 완료: expiresAt=%s rotated=%s", grant.expiresAt(), grant.refreshToken() != null);
        return grant;
    }

    private TokenGrant execute(TokenRequest request, String action) {
        Instant requestedAt = clockPort.now().toInstant();
        TokenResponse response;
        try {
            response = request.execute();
        } catch (TokenResponseException e) {
            throw classify(e, action);
        } catch (IOException e) {
            throw AuthorizationException.transientFailure(action + " 중 통신 실패: " + e.getMessage(), e);
        }
        return toGrant(response, requestedAt);
    }

    private AuthorizationException classify(TokenResponseException e, String action) {
        int status = e.getStatusCode();
        String error = errorCode(e);
        String message = action + " 실패 status=" + status + (error == null ? "" : " error=" + error);
        if (error != null && TERMINAL_ERRORS.contains(error)) {
            log.warnf("%s (재인증 필요)", message);
            return AuthorizationException.terminal(message, e);
        }
        if (status == 429 || status >= 500) {
            log.warnf("%s (일시 오류)", message);
        } else {
            log.errorf("%s (클라이언트 ID/시크릿 또는 요청 설정을 확인하세요. 저장된 자격 증명은 유지합니다)", message);
        }
        return AuthorizationException.transientFailure(message, e);
    }

    /**
     * Fitbit 은 표준 error 필드 대신 errors[].errorType 을 돌려주기도 한다.
     */
    private String errorCode(TokenResponseException e) {
        TokenErrorResponse details = e.getDetails();
        if (details != null && details.getError() != null) {
            return details.getError();
        }
        String content = e.getContent();
        if (content == null) {
            return null;
        }
        for (String candidate : TERMINAL_ERRORS) {
            if (content.contains("\"" + candidate + "\"")) {
                return candidate;
            }
        }
        return null;
    }

    private TokenGrant toGrant(TokenResponse response, Instant requestedAt) {
        Long expiresIn = response.getExpiresInSeconds();
        if (response.getAccessToken() == null || expiresIn == null) {
            throw AuthorizationException.transientFailure("토큰 응답에 access_token 또는 expires_in 이 없습니다.", null);
        }
        Object userId = response.get("user_id");
        return new TokenGrant(
                response.getAccessToken(),
                response.getRefreshToken(),
                requestedAt.plus(Duration.ofSeconds(expiresIn)),
                parseScopes(response.getScope()),
                response.getTokenType(),
                userId == null ? null : userId.toString()
        );
    }

    private static Set<String> parseScopes(String scope) {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private HttpRequestInitializer timeouts() {
        int millis = (int) Duration.ofSeconds(fitbitConfig.requestTimeoutSeconds()).toMillis();
        return httpRequest -> {
            httpRequest.setConnectTimeout(millis);
            httpRequest.setReadTimeout(millis);
        };
    }

    private BasicAuthentication clientAuthentication() {
        return new BasicAuthentication(clientId(), fitbitConfig.clientSecret().orElse(""));
    }

    private String clientId() {
        return fitbitConfig.clientId().orElse("");
    }
}
