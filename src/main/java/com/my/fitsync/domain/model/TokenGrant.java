package com.my.fitsync.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 토큰 엔드포인트 응답을 저장 형태와 분리해 OAuth 어댑터가 저장소를 알 필요가 없도록 하기 위함.
 * refreshToken 과 subjectId 는 갱신 응답에서 생략될 수 있다.
 */
public record TokenGrant(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        Set<String> scopes,
        String tokenType,
        String subjectId
) {
    public TokenGrant {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (accessToken.isBlank()) {
            throw new IllegalArgumentException("access token 이 비어 있습니다.");
        }
        if (refreshToken != null && refreshToken.isBlank()) {
            refreshToken = null;
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    @Override
    public String toString() {
        return "TokenGrant[expiresAt=" + expiresAt + ", scopes=" + scopes + ", subjectId=" + subjectId + "]";
    }
}
