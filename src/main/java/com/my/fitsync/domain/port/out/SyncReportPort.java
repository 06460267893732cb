package com.my.fitsync.domain.port.out;

import com.my.fitsync.domain.model.SyncReport;

/**
 * 왜: 동기화 보고서 전달 채널(RabbitMQ 등) 세부 구현을 숨기고 도메인이 단일 계약으로 결과를 알리도록 하기 위함.
 */
public interface SyncReportPort {
    void publish(SyncReport report);
}
