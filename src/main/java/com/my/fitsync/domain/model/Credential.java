package com.my.fitsync.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 외부 계정 연동 한 건의 토큰 쌍과 메타데이터를 하나의 불변 값으로 다뤄 부분 갱신이 보이지 않도록 하기 위함.
 */
public record Credential(
        String accountKey,
        String subjectId,
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        Set<String> scopes,
        String tokenType,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public Credential {
        Objects.requireNonNull(accountKey, "accountKey");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (accountKey.isBlank() || accessToken.isBlank() || refreshToken.isBlank()) {
            throw new IllegalArgumentException("계정 키와 토큰은 비어 있을 수 없습니다.");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        tokenType = tokenType == null || tokenType.isBlank() ? DEFAULT_TOKEN_TYPE : tokenType;
    }

    /**
     * 최초 코드 교환 결과로 자격 증명을 만든다.
     */
    public static Credential issue(String accountKey, TokenGrant grant, Instant now) {
        return new Credential(
                accountKey,
                grant.subjectId() == null ? "unknown" : grant.subjectId(),
                grant.accessToken(),
                grant.refreshToken(),
                grant.expiresAt(),
                grant.scopes(),
                grant.tokenType(),
                now,
                now
        );
    }

    /**
     * 갱신 결과를 덮어쓴다. 공급자가 refresh token 을 회전시키지 않았으면 기존 값을 유지한다.
     */
    public Credential refreshedWith(TokenGrant grant, Instant now) {
        return new Credential(
                accountKey,
                grant.subjectId() == null ? subjectId : grant.subjectId(),
                grant.accessToken(),
                grant.refreshToken() == null ? refreshToken : grant.refreshToken(),
                grant.expiresAt(),
                grant.scopes().isEmpty() ? scopes : grant.scopes(),
                grant.tokenType(),
                createdAt,
                now.isBefore(updatedAt) ? updatedAt : now
        );
    }

    public boolean isExpiringWithin(Duration margin, Instant now) {
        return !expiresAt.isAfter(now.plus(margin));
    }

    @Override
    public String toString() {
        return "Credential[accountKey=" + accountKey
                + ", subjectId=" + subjectId
                + ", accessToken=***, refreshToken=***"
                + ", expiresAt=" + expiresAt
                + ", scopes=" + scopes
                + ", tokenType=" + tokenType
                + ", createdAt=" + createdAt
                + ", updatedAt=" + updatedAt + "]";
    }
}
