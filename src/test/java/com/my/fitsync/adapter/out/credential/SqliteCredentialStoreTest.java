package com.my.fitsync.adapter.out.credential;

import com.my.fitsync.config.PersistenceConfig;
import com.my.fitsync.domain.model.Credential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteCredentialStoreTest {

    private static final Instant T = Instant.parse("2026-03-09T15:00:00Z");

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private SqliteCredentialStore store;

    @BeforeEach
    void setUp() {
        dataSource = PersistenceConfig.sqliteDataSource(tempDir.resolve("db/credentials.db"));
        store = new SqliteCredentialStore(dataSource);
        store.init();
    }

    @Test
    void storesAndLoadsCredential() {
        Credential credential = credential("a1", T, T);

        store.put("default", credential);

        assertThat(store.get("default")).contains(credential);
        assertThat(store.get("other")).isEmpty();
    }

    @Test
    void survivesRestart() {
        store.put("default", credential("a1", T, T));

        SqliteCredentialStore reopened = new SqliteCredentialStore(PersistenceConfig.sqliteDataSource(tempDir.resolve("db/credentials.db")));
        reopened.init();

        assertThat(reopened.get("default").map(Credential::accessToken)).contains("a1");
    }

    @Test
    void ignoresOlderWritesAndKeepsCreatedAt() {
        store.put("default", credential("a1", T.minusSeconds(100), T));
        store.put("default", credential("a2", T, T.plusSeconds(10)));
        store.put("default", credential("stale", T.plusSeconds(50), T.plusSeconds(5)));

        Credential stored = store.get("default").orElseThrow();
        assertThat(stored.accessToken()).isEqualTo("a2");
        assertThat(stored.createdAt()).isEqualTo(T.minusSeconds(100));
        assertThat(stored.updatedAt()).isEqualTo(T.plusSeconds(10));
    }

    @Test
    void concurrentWritesKeepTheLatestUpdate() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.put("default", credential("a" + index, T, T.plusSeconds(index)));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("default").map(Credential::accessToken)).contains("a" + (writers - 1));
    }

    @Test
    void deleteIsIdempotent() {
        store.put("default", credential("a1", T, T));

        assertThat(store.delete("default")).isTrue();
        assertThat(store.delete("default")).isFalse();
        assertThat(store.get("default")).isEmpty();
    }

    @Test
    void rejectsMismatchedAccountKey() {
        assertThatThrownBy(() -> store.put("other", credential("a1", T, T)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Credential credential(String access, Instant createdAt, Instant updatedAt) {
        return new Credential("default", "ABC", access, "r1", T.plusSeconds(28800),
                Set.of("activity", "heartrate"), "Bearer", createdAt, updatedAt);
    }
}
