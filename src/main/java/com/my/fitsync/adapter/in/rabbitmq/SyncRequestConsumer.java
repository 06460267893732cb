package com.my.fitsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.port.in.SyncUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.Optional;

/**
 * 왜: 다른 서비스가 RabbitMQ로 요청한 동기화를 도메인 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 */
@ApplicationScoped
public class SyncRequestConsumer {

    private static final Logger log = Logger.getLogger(SyncRequestConsumer.class);

    private final SyncUseCase syncUseCase;
    private final ObjectMapper objectMapper;
    private final String defaultAccountKey;

    @Inject
    public SyncRequestConsumer(SyncUseCase syncUseCase, ObjectMapper objectMapper, AppConfig appConfig) {
        this(syncUseCase, objectMapper, appConfig.sync().accountKey());
    }

    SyncRequestConsumer(SyncUseCase syncUseCase, ObjectMapper objectMapper, String defaultAccountKey) {
        this.syncUseCase = syncUseCase;
        this.objectMapper = objectMapper;
        this.defaultAccountKey = defaultAccountKey;
    }

    @Incoming("sync-requests")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message);
            return null;
        }).replaceWithVoid();
    }

    void handle(Message<String> message) {
        IncomingSyncRequest.SyncCommand command;
        try {
            IncomingSyncRequest incoming = objectMapper.readValue(message.getPayload(), IncomingSyncRequest.class);
            command = incoming.toCommand(defaultAccountKey);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("동기화 요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        String correlationId = resolveCorrelationId(message).orElse(command.requestId());
        MDC.put("correlationId", correlationId);
        MDC.put("accountKey", command.accountKey());
        try {
            SyncReport report = syncUseCase.runSync(command.accountKey(), command.date());
            log.infof("동기화 요청 처리 완료: date=%s status=%s failed=%s",
                    report.date(), report.status(), report.failedMetrics());
        } catch (InvalidRequestException e) {
            log.warnf("동기화 요청 검증 실패로 처리 중단: %s", e.getMessage());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("accountKey");
        }
    }

    private Optional<String> resolveCorrelationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
