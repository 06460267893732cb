package com.my.fitsync.adapter.in.rabbitmq;

import io.quarkus.arc.profile.IfBuildProfile;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 처리되지 못한 동기화 요청이 DLQ 에 쌓이는 것을 로그로 드러내기 위함.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class DeadLetterConsumer {

    private static final Logger log = Logger.getLogger(DeadLetterConsumer.class);

    @Incoming("sync-requests-dlq")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        Optional<Map<String, Object>> headers = message.getMetadata(IncomingRabbitMQMetadata.class)
                .map(IncomingRabbitMQMetadata::getHeaders);
        log.warnf("DLQ 동기화 요청: reason=%s, queue=%s, payload=%s",
                header(headers, "x-first-death-reason"),
                header(headers, "x-first-death-queue"),
                message.getPayload());
        return message.ack();
    }

    private static String header(Optional<Map<String, Object>> headers, String name) {
        return headers.map(values -> String.valueOf(values.getOrDefault(name, "unknown"))).orElse("unknown");
    }
}
