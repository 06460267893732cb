package com.my.fitsync.domain.exception;

/**
 * 왜: 저장된 자격 증명이 없거나 폐기되어 사용자가 다시 인증해야 하는 상황을 암묵적 재인증 없이 드러내기 위함.
 */
public class NotConnectedException extends RuntimeException {

    private final String accountKey;

    public NotConnectedException(String accountKey) {
        super("연결된 Fitbit 계정이 없습니다: " + accountKey);
        this.accountKey = accountKey;
    }

    public NotConnectedException(String accountKey, Throwable cause) {
        super("Fitbit 자격 증명이 폐기되어 다시 인증해야 합니다: " + accountKey, cause);
        this.accountKey = accountKey;
    }

    public String accountKey() {
        return accountKey;
    }
}
