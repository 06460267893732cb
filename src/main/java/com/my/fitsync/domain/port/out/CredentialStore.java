package com.my.fitsync.domain.port.out;

import com.my.fitsync.domain.model.Credential;

import java.util.Optional;

/**
 * 왜: 토큰 상태의 유일한 기록 지점을 계정 키 단위 계약으로 고정해 단일/다중 사용자 배포가 같은 저장 규칙을 공유하게 하기 위함.
 */
public interface CredentialStore {

    Optional<Credential> get(String accountKey);

    /**
     * 왜: 계정당 하나의 자격 증명만 남도록 덮어쓰되, updatedAt 이 더 오래된 쓰기는 무시해 마지막 논리적 쓰기가 남게 하기 위함.
     */
    void put(String accountKey, Credential credential);

    /**
     * 없는 자격 증명을 지워도 오류가 아니다.
     *
     * @return 삭제 전에 자격 증명이 있었는지 여부
     */
    boolean delete(String accountKey);
}
