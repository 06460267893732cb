package com.my.fitsync.domain.exception;

/**
 * 왜: 토큰 엔드포인트 실패를 영구(재인증 필요)와 일시(재시도 가능)로 구분해 호출자가 자격 증명 삭제 여부를 판단하게 하기 위함.
 */
public class AuthorizationException extends RuntimeException {

    private final boolean terminal;

    public AuthorizationException(String message, boolean terminal) {
        super(message);
        this.terminal = terminal;
    }

    public AuthorizationException(String message, boolean terminal, Throwable cause) {
        super(message, cause);
        this.terminal = terminal;
    }

    public static AuthorizationException terminal(String message, Throwable cause) {
        return new AuthorizationException(message, true, cause);
    }

    public static AuthorizationException transientFailure(String message, Throwable cause) {
        return new AuthorizationException(message, false, cause);
    }

    public boolean terminal() {
        return terminal;
    }
}
