package com.my.fitsync.domain.exception;

import com.my.fitsync.domain.model.FailureReason;

/**
 * 왜: 재시도 대상인 전송/서버 오류만 별도 타입으로 분리해 재시도 정책이 인증·호출 제한 오류를 반복하지 않도록 하기 위함.
 */
public class TransientFetchException extends MetricFetchException {

    public TransientFetchException(String message) {
        super(FailureReason.TRANSPORT, message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(FailureReason.TRANSPORT, message, null, cause);
    }
}
