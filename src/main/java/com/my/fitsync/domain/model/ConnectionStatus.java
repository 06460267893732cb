package com.my.fitsync.domain.model;

import java.time.Instant;
import java.util.Set;

/**
 * 왜: 연결 상태를 토큰 값 없이 노출해 상태 조회 응답에 비밀 정보가 섞이지 않도록 하기 위함.
 */
public record ConnectionStatus(
        String accountKey,
        boolean connected,
        String subjectId,
        Instant expiresAt,
        Set<String> scopes,
        Instant updatedAt
) {
    public static ConnectionStatus disconnected(String accountKey) {
        return new ConnectionStatus(accountKey, false, null, null, Set.of(), null);
    }

    public static ConnectionStatus of(Credential credential) {
        return new ConnectionStatus(
                credential.accountKey(),
                true,
                credential.subjectId(),
                credential.expiresAt(),
                credential.scopes(),
                credential.updatedAt()
        );
    }
}
