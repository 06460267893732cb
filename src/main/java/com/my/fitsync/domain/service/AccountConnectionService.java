package com.my.fitsync.domain.service;

import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.model.AccountKeys;
import com.my.fitsync.domain.model.AuthorizationRedirect;
import com.my.fitsync.domain.model.ConnectionStatus;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.TokenGrant;
import com.my.fitsync.domain.port.in.ConnectAccountUseCase;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.CredentialStore;
import com.my.fitsync.domain.port.out.OAuthPort;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 인증 시작부터 콜백 검증, 토큰 저장, 연결 해제까지의 흐름을 도메인에 두어 웹 계층은 요청 전달만 하도록 하기 위함.
 */
public class AccountConnectionService implements ConnectAccountUseCase {

    static final Duration STATE_TTL = Duration.ofMinutes(10);

    private final OAuthPort oAuthPort;
    private final TokenLifecycleManager tokenLifecycleManager;
    private final CredentialStore credentialStore;
    private final ClockPort clockPort;
    private final String redirectUri;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, PendingAuthorization> pending = new ConcurrentHashMap<>();

    public AccountConnectionService(OAuthPort oAuthPort,
                                    TokenLifecycleManager tokenLifecycleManager,
                                    CredentialStore credentialStore,
                                    ClockPort clockPort,
                                    String redirectUri) {
        this.oAuthPort = oAuthPort;
        this.tokenLifecycleManager = tokenLifecycleManager;
        this.credentialStore = credentialStore;
        this.clockPort = clockPort;
        this.redirectUri = redirectUri;
    }

    @Override
    public AuthorizationRedirect beginAuthorization(String accountKey) {
        AccountKeys.requireValid(accountKey);
        purgeExpired();
        String state = newState();
        pending.put(state, new PendingAuthorization(accountKey, now()));
        return new AuthorizationRedirect(accountKey, state, oAuthPort.authorizationUri(state, redirectUri));
    }

    @Override
    public Credential completeAuthorization(String state, String authorizationCode) {
        if (state == null || state.isBlank()) {
            throw new InvalidRequestException("OAuth state 가 없습니다.");
        }
        // state 는 성공/실패와 무관하게 한 번만 쓸 수 있다
        PendingAuthorization authorization = pending.remove(state);
        if (authorization == null || authorization.isExpired(now())) {
            throw new InvalidRequestException("OAuth state 가 일치하지 않거나 만료되었습니다. 다시 시도해주세요.");
        }
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new InvalidRequestException("인가 코드가 없습니다.");
        }
        TokenGrant grant = oAuthPort.exchangeCode(authorizationCode, redirectUri);
        return tokenLifecycleManager.connect(authorization.accountKey(), grant);
    }

    @Override
    public boolean disconnect(String accountKey) {
        return tokenLifecycleManager.disconnect(accountKey);
    }

    @Override
    public ConnectionStatus status(String accountKey) {
        return credentialStore.get(accountKey)
                .map(ConnectionStatus::of)
                .orElseGet(() -> ConnectionStatus.disconnected(accountKey));
    }

    private void purgeExpired() {
        Instant now = now();
        pending.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    }

    private String newState() {
        byte[] bytes = new byte[24];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private Instant now() {
        return clockPort.now().toInstant();
    }

    private record PendingAuthorization(String accountKey, Instant issuedAt) {
        boolean isExpired(Instant now) {
            return issuedAt.plus(STATE_TTL).isBefore(now);
        }
    }
}
