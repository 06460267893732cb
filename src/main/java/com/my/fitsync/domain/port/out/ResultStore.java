package com.my.fitsync.domain.port.out;

import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;
import com.my.fitsync.domain.model.StoredArtifact;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 수집 결과 저장을 파일/오브젝트 스토리지 등 구현과 분리하고, 중간에 실패해도 깨진 결과가 보이지 않는 쓰기 규칙을 계약으로 두기 위함.
 */
public interface ResultStore {

    void save(String accountKey, MetricKind kind, LocalDate date, MetricPayload payload);

    boolean exists(String accountKey, MetricKind kind, LocalDate date);

    Optional<StoredArtifact> find(String accountKey, MetricKind kind, LocalDate date);

    /**
     * 별도 색인 없이 저장 결과만으로 동기화 이력을 복원한다. 날짜, 지표 이름 순.
     */
    List<StoredArtifact> history(String accountKey);
}
