package com.my.fitsync.domain.model;

import com.my.fitsync.domain.exception.InvalidRequestException;

import java.util.regex.Pattern;

/**
 * 왜: 계정 키는 저장 디렉터리 이름으로도 쓰이므로, 연결 시점에 거르지 않으면 토큰은 저장되고 결과 저장만 나중에 실패한다.
 */
public final class AccountKeys {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,63}");

    private AccountKeys() {
    }

    public static boolean isValid(String accountKey) {
        return accountKey != null && SAFE_KEY.matcher(accountKey).matches();
    }

    /**
     * @throws InvalidRequestException 비어 있거나 영문/숫자/'.'/'_'/'-' 이외 문자가 있거나 '.' 으로 시작하거나 64자를 넘는 경우
     */
    public static String requireValid(String accountKey) {
        if (accountKey == null || accountKey.isBlank()) {
            throw new InvalidRequestException("계정 키가 비어 있습니다.");
        }
        if (!isValid(accountKey)) {
            throw new InvalidRequestException("계정 키에 사용할 수 없는 문자가 있습니다: " + accountKey);
        }
        return accountKey;
    }
}
