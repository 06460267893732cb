package com.my.fitsync.domain.service;

import com.my.fitsync.domain.exception.AuthorizationException;
import com.my.fitsync.domain.exception.NotConnectedException;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.TokenGrant;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.CredentialStore;
import com.my.fitsync.domain.port.out.OAuthPort;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 토큰 갱신 시점 판단과 갱신 직렬화를 한곳에서 책임져, 같은 refresh token 이 두 번 사용되어 정상 세션이 무효화되는 일을 막기 위함.
 *
 * <p>계정 키마다 락을 하나 두고, 락 안에서 만료 여부를 다시 확인한다(double-check). 따라서 계정 키당 진행 중인 갱신은 최대 하나다.
 * 연결/해제도 같은 락을 거치므로 진행 중인 갱신이 방금 해제된 자격 증명을 되살리지 않는다.
 */
public class TokenLifecycleManager {

    private final CredentialStore credentialStore;
    private final OAuthPort oAuthPort;
    private final ClockPort clockPort;
    private final Duration refreshMargin;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public TokenLifecycleManager(CredentialStore credentialStore,
                                 OAuthPort oAuthPort,
                                 ClockPort clockPort,
                                 Duration refreshMargin) {
        this.credentialStore = credentialStore;
        this.oAuthPort = oAuthPort;
        this.clockPort = clockPort;
        this.refreshMargin = Objects.requireNonNull(refreshMargin, "refreshMargin");
        if (refreshMargin.isNegative()) {
            throw new IllegalArgumentException("갱신 여유 시간은 음수일 수 없습니다.");
        }
    }

    /**
     * 만료까지 여유 시간 이상 남은 자격 증명을 돌려준다. 필요하면 갱신한다.
     *
     * @throws NotConnectedException 저장된 자격 증명이 없거나 갱신이 영구 거부된 경우(이때 자격 증명은 삭제된다)
     * @throws AuthorizationException 일시적 갱신 실패. 저장소는 변경되지 않는다
     */
    public Credential validCredential(String accountKey) {
        Credential current = load(accountKey);
        if (!current.isExpiringWithin(refreshMargin, now())) {
            return current;
        }
        ReentrantLock lock = lockFor(accountKey);
        lock.lock();
        try {
            Credential latest = load(accountKey);
            if (!latest.isExpiringWithin(refreshMargin, now())) {
                return latest;
            }
            return refreshLocked(accountKey, latest);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 공급자가 401 로 거부한 자격 증명을 다시 검증한다.
     * 다른 호출자가 이미 갱신했다면 저장된 새 자격 증명을 돌려주고, 그렇지 않으면 만료 시각과 무관하게 갱신한다.
     */
    public Credential revalidate(String accountKey, Credential rejected) {
        ReentrantLock lock = lockFor(accountKey);
        lock.lock();
        try {
            Credential latest = load(accountKey);
            if (!latest.accessToken().equals(rejected.accessToken())) {
                return latest;
            }
            return refreshLocked(accountKey, latest);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 인가 코드 교환 직후 자격 증명을 저장한다. 기존 연결이 있으면 createdAt 을 유지한다.
     */
    public Credential connect(String accountKey, TokenGrant grant) {
        ReentrantLock lock = lockFor(accountKey);
        lock.lock();
        try {
            Instant now = now();
            Credential credential = credentialStore.get(accountKey)
                    .map(existing -> existing.refreshedWith(grant, now))
                    .orElseGet(() -> Credential.issue(accountKey, grant, now));
            credentialStore.put(accountKey, credential);
            return credential;
        } finally {
            lock.unlock();
        }
    }

    public boolean disconnect(String accountKey) {
        ReentrantLock lock = lockFor(accountKey);
        lock.lock();
        try {
            return credentialStore.delete(accountKey);
        } finally {
            lock.unlock();
        }
    }

    private Credential refreshLocked(String accountKey, Credential stale) {
        TokenGrant grant;
        try {
            grant = oAuthPort.refresh(stale.refreshToken());
        } catch (AuthorizationException e) {
            if (e.terminal()) {
                // 거부된 refresh token 은 다시 쓰지 않는다
                credentialStore.delete(accountKey);
                throw new NotConnectedException(accountKey, e);
            }
            throw e;
        }
        Credential refreshed = stale.refreshedWith(grant, now());
        credentialStore.put(accountKey, refreshed);
        return refreshed;
    }

    private Credential load(String accountKey) {
        return credentialStore.get(accountKey)
                .orElseThrow(() -> new NotConnectedException(accountKey));
    }

    private ReentrantLock lockFor(String accountKey) {
        return locks.computeIfAbsent(accountKey, key -> new ReentrantLock());
    }

    private Instant now() {
        return clockPort.now().toInstant();
    }
}
