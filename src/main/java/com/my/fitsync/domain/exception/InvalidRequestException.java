package com.my.fitsync.domain.exception;

/**
 * 왜: 날짜 범위, 지표 이름, OAuth state 처럼 호출자가 넘긴 값이 잘못된 경우를 동기화 실패와 구분해 400 계열로 응답하기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
