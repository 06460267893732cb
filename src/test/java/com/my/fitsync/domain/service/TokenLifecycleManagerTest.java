package com.my.fitsync.domain.service;

import com.my.fitsync.adapter.out.credential.InMemoryCredentialStore;
import com.my.fitsync.domain.exception.AuthorizationException;
import com.my.fitsync.domain.exception.NotConnectedException;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.TokenGrant;
import com.my.fitsync.domain.port.out.ClockPort;
import com.my.fitsync.domain.port.out.OAuthPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenLifecycleManagerTest {

    private static final Instant T = Instant.parse("2026-03-09T15:00:00Z");

    private InMemoryCredentialStore credentialStore;
    private OAuthPort oAuthPort;
    private AtomicReference<Instant> now;
    private TokenLifecycleManager manager;

    @BeforeEach
    void setUp() {
        credentialStore = new InMemoryCredentialStore();
        oAuthPort = mock(OAuthPort.class);
        now = new AtomicReference<>(T);
        ClockPort clockPort = () -> OffsetDateTime.ofInstant(now.get(), ZoneOffset.UTC);
        manager = new TokenLifecycleManager(credentialStore, oAuthPort, clockPort, Duration.ofSeconds(60));
    }

    @Test
    void returnsStoredCredentialWhenFreshBeyondMargin() {
        store(credential("a1", "r1", T.plusSeconds(3600)));

        Credential valid = manager.validCredential("default");

        assertThat(valid.accessToken()).isEqualTo("a1");
        verify(oAuthPort, never()).refresh(anyString());
    }

    @Test
    void refreshesExpiredCredentialAndPersistsIt() {
        store(credential("a1", "r1", T));
        now.set(T.plusSeconds(5));
        when(oAuthPort.refresh("r1")).thenReturn(grant("a2", null, T.plusSeconds(28800)));

        Credential valid = manager.validCredential("default");

        assertThat(valid.accessToken()).isEqualTo("a2");
        assertThat(valid.refreshToken()).isEqualTo("r1");
        assertThat(credentialStore.get("default")).contains(valid);
        verify(oAuthPort, times(1)).refresh("r1");
    }

    @Test
    void refreshesWhenInsideMargin() {
        store(credential("a1", "r1", T.plusSeconds(30)));
        when(oAuthPort.refresh("r1")).thenReturn(grant("a2", "r2", T.plusSeconds(28800)));

        assertThat(manager.validCredential("default").refreshToken()).isEqualTo("r2");
    }

    @Test
    void missingCredentialIsNotConnected() {
        assertThatThrownBy(() -> manager.validCredential("default"))
                .isInstanceOf(NotConnectedException.class);
        verify(oAuthPort, never()).refresh(anyString());
    }

    @Test
    void terminalRefreshFailureDeletesCredential() {
        store(credential("a1", "r1", T.minusSeconds(10)));
        when(oAuthPort.refresh("r1")).thenThrow(AuthorizationException.terminal("invalid_grant", null));

        assertThatThrownBy(() -> manager.validCredential("default"))
                .isInstanceOf(NotConnectedException.class)
                .hasCauseInstanceOf(AuthorizationException.class);
        assertThat(credentialStore.get("default")).isEmpty();
    }

    @Test
    void transientRefreshFailureLeavesStorageUntouched() {
        Credential stale = credential("a1", "r1", T.minusSeconds(10));
        store(stale);
        when(oAuthPort.refresh("r1")).thenThrow(AuthorizationException.transientFailure("503", null));

        assertThatThrownBy(() -> manager.validCredential("default"))
                .isInstanceOf(AuthorizationException.class)
                .matches(e -> !((AuthorizationException) e).terminal());
        assertThat(credentialStore.get("default")).contains(stale);
    }

    @Test
    void concurrentCallersShareASingleRefresh() throws Exception {
        store(credential("a1", "r1", T));
        now.set(T.plusSeconds(5));
        when(oAuthPort.refresh("r1")).thenAnswer(invocation -> {
            Thread.sleep(100);
            return grant("a2", "r2", T.plusSeconds(28800));
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Credential>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return manager.validCredential("default");
                }));
            }
            start.countDown();
            for (Future<Credential> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS).accessToken()).isEqualTo("a2");
            }
        } finally {
            pool.shutdownNow();
        }
        verify(oAuthPort, times(1)).refresh(anyString());
    }

    @Test
    void revalidateReturnsCredentialRefreshedByAnotherCaller() {
        Credential rejected = credential("a1", "r1", T.plusSeconds(3600));
        store(credential("a2", "r2", T.plusSeconds(28800)));

        Credential result = manager.revalidate("default", rejected);

        assertThat(result.accessToken()).isEqualTo("a2");
        verify(oAuthPort, never()).refresh(anyString());
    }

    @Test
    void revalidateForcesRefreshOfRejectedToken() {
        Credential rejected = credential("a1", "r1", T.plusSeconds(3600));
        store(rejected);
        when(oAuthPort.refresh("r1")).thenReturn(grant("a2", null, T.plusSeconds(28800)));

        assertThat(manager.revalidate("default", rejected).accessToken()).isEqualTo("a2");
    }

    @Test
    void connectKeepsCreatedAtOfExistingConnection() {
        Credential existing = credential("a1", "r1", T);
        store(existing);

        Credential connected = manager.connect("default", grant("a9", "r9", T.plusSeconds(28800)));

        assertThat(connected.createdAt()).isEqualTo(existing.createdAt());
        assertThat(credentialStore.get("default").map(Credential::refreshToken)).contains("r9");
    }

    @Test
    void disconnectIsIdempotent() {
        store(credential("a1", "r1", T));

        assertThat(manager.disconnect("default")).isTrue();
        assertThat(manager.disconnect("default")).isFalse();
        assertThatThrownBy(() -> manager.validCredential("default")).isInstanceOf(NotConnectedException.class);
    }

    private void store(Credential credential) {
        credentialStore.put(credential.accountKey(), credential);
    }

    private static Credential credential(String access, String refresh, Instant expiresAt) {
        return new Credential("default", "ABC", access, refresh, expiresAt, Set.of("activity"), "Bearer",
                T.minusSeconds(86400), T.minusSeconds(28800));
    }

    private static TokenGrant grant(String access, String refresh, Instant expiresAt) {
        return new TokenGrant(access, refresh, expiresAt, Set.of(), "Bearer", null);
    }
}
