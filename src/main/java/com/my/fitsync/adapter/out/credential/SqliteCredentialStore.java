package com.my.fitsync.adapter.out.credential;

import com.my.fitsync.domain.exception.StorageException;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.port.out.CredentialStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 왜: 재시작 후에도 연결이 유지되도록 계정 키를 기본 키로 하는 SQLite 테이블에 자격 증명을 한 행씩 보관하기 위함.
 * 행 단위 upsert 한 문장으로 쓰므로 읽는 쪽은 반쯤 쓰인 토큰을 보지 않는다.
 */
@IfBuildProperty(name = "app.credential.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteCredentialStore implements CredentialStore {

    private static final Logger log = Logger.getLogger(SqliteCredentialStore.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS oauth_credential (
                account_key TEXT PRIMARY KEY,
                subject_id TEXT NOT NULL,
                access_token TEXT NOT NULL,
                refresh_token TEXT NOT NULL,
                expires_at INTEGER NOT NULL,
                scope TEXT NOT NULL DEFAULT '',
                token_type TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;

    // updated_at 이 더 오래된 쓰기는 조용히 무시된다
    private static final String UPSERT_SQL = """
            INSERT INTO oauth_credential(account_key, subject_id, access_token, refresh_token, expires_at,
                                         scope, token_type, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(account_key) DO UPDATE SET
                subject_id = excluded.subject_id,
                access_token = excluded.access_token,
                refresh_token = excluded.refresh_token,
                expires_at = excluded.expires_at,
                scope = excluded.scope,
                token_type = excluded.token_type,
                updated_at = excluded.updated_at
            WHERE excluded.updated_at >= oauth_credential.updated_at
            """;

    private static final String SELECT_SQL = """
            SELECT account_key, subject_id, access_token, refresh_token, expires_at, scope, token_type, created_at, updated_at
            FROM oauth_credential WHERE account_key = ?
            """;

    private static final String DELETE_SQL = "DELETE FROM oauth_credential WHERE account_key = ?";

    private final DataSource dataSource;
    private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public SqliteCredentialStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<Credential> get(String accountKey) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, accountKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("자격 증명 조회 실패: " + accountKey, e);
        }
    }

    @Override
    public void put(String accountKey, Credential credential) {
        requireSameKey(accountKey, credential);
        ReentrantLock lock = writeLocks.computeIfAbsent(accountKey, key -> new ReentrantLock());
        lock.lock();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, accountKey);
            ps.setString(2, credential.subjectId());
            ps.setString(3, credential.accessToken());
            ps.setString(4, credential.refreshToken());
            ps.setLong(5, credential.expiresAt().toEpochMilli());
            ps.setString(6, String.join(" ", credential.scopes()));
            ps.setString(7, credential.tokenType());
            ps.setLong(8, credential.createdAt().toEpochMilli());
            ps.setLong(9, credential.updatedAt().toEpochMilli());
            if (ps.executeUpdate() == 0) {
                log.infof("더 오래된 자격 증명 쓰기를 무시합니다: account=%s updatedAt=%s", accountKey, credential.updatedAt());
            }
        } catch (SQLException e) {
            throw new StorageException("자격 증명 저장 실패: " + accountKey, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String accountKey) {
        ReentrantLock lock = writeLocks.computeIfAbsent(accountKey, key -> new ReentrantLock());
        lock.lock();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, accountKey);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("자격 증명 삭제 실패: " + accountKey, e);
        } finally {
            lock.unlock();
        }
    }

    private Credential map(ResultSet rs) throws SQLException {
        return new Credential(
                rs.getString("account_key"),
                rs.getString("subject_id"),
                rs.getString("access_token"),
                rs.getString("refresh_token"),
                Instant.ofEpochMilli(rs.getLong("expires_at")),
                parseScopes(rs.getString("scope")),
                rs.getString("token_type"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at"))
        );
    }

    private static Set<String> parseScopes(String scope) {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static void requireSameKey(String accountKey, Credential credential) {
        if (!credential.accountKey().equals(accountKey)) {
            throw new IllegalArgumentException("계정 키가 일치하지 않습니다: " + accountKey + " != " + credential.accountKey());
        }
    }
}
