package com.my.fitsync.domain.port.out;

import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.model.MetricKind;
import com.my.fitsync.domain.model.MetricPayload;

import java.time.LocalDate;

/**
 * 왜: 일별 요약/intraday 엔드포인트를 "날짜별 지표 조회" 하나의 계약으로 감싸 도메인이 공급자 URL 규칙을 모르게 하기 위함.
 * 데이터가 없는 날짜는 오류가 아니라 {@link MetricPayload#empty()} 로 돌려준다.
 */
public interface MetricFetchPort {
    MetricPayload fetch(MetricKind kind, LocalDate date, Credential credential);
}
