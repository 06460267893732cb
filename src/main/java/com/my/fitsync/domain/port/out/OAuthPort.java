package com.my.fitsync.domain.port.out;

import com.my.fitsync.domain.model.TokenGrant;

import java.net.URI;

/**
 * 왜: 인가 서버와의 코드 교환/토큰 갱신을 추상화하여 도메인이 OAuth 라이브러리 세부 구현에 의존하지 않도록 하기 위함.
 * 구현은 저장소를 건드리지 않는다.
 */
public interface OAuthPort {

    /**
     * 왜: 사용자가 직접 승인할 동의 화면 링크를 CSRF state 와 함께 만들기 위함.
     */
    URI authorizationUri(String state, String redirectUri);

    /**
     * 인가 코드는 일회용이므로 실패해도 자동 재시도하지 않는다.
     */
    TokenGrant exchangeCode(String authorizationCode, String redirectUri);

    TokenGrant refresh(String refreshToken);
}
