package com.my.fitsync.domain.exception;

import com.my.fitsync.domain.model.FailureReason;

import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 지표 조회 실패 사유(인증, 호출 제한, 전송 등)를 호출자에게 그대로 전달해 지표별로 다르게 대응하기 위함.
 */
public class MetricFetchException extends RuntimeException {

    private final FailureReason reason;
    private final Duration retryAfter;

    public MetricFetchException(FailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public MetricFetchException(FailureReason reason, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public FailureReason reason() {
        return reason;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
