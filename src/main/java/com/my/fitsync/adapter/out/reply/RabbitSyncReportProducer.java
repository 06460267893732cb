package com.my.fitsync.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.port.out.SyncReportPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 동기화 보고서를 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 * 보고서 발행 실패가 이미 끝난 동기화 결과를 바꾸지 않도록 예외는 로그로만 남긴다.
 */
@ApplicationScoped
public class RabbitSyncReportProducer implements SyncReportPort {

    private static final Logger log = Logger.getLogger(RabbitSyncReportProducer.class);

    private final Emitter<String> reportEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitSyncReportProducer(@Channel("sync-reports") Emitter<String> reportEmitter, ObjectMapper objectMapper) {
        this.reportEmitter = reportEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(SyncReport report) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(SyncReportMessage.from(report));
        } catch (JsonProcessingException e) {
            log.warnf("동기화 보고서 직렬화 실패: account=%s date=%s (%s)", report.accountKey(), report.date(), e.getMessage());
            return;
        }
        try {
            reportEmitter.send(payload);
        } catch (RuntimeException e) {
            log.warnf("동기화 보고서 발행 실패: account=%s date=%s (%s)", report.accountKey(), report.date(), e.getMessage());
        }
    }
}
