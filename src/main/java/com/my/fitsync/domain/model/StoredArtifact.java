package com.my.fitsync.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * 왜: (계정, 지표, 날짜) 당 하나뿐인 저장 결과를 표현해 재동기화가 덮어쓰기임을 타입으로 드러내기 위함.
 */
public record StoredArtifact(String accountKey, String metric, LocalDate date, byte[] payload, Instant storedAt) {

    public StoredArtifact {
        Objects.requireNonNull(accountKey, "accountKey");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(storedAt, "storedAt");
    }

    public int size() {
        return payload.length;
    }
}
