package com.my.fitsync.domain.port.in;

import com.my.fitsync.domain.model.AuthorizationRedirect;
import com.my.fitsync.domain.model.ConnectionStatus;
import com.my.fitsync.domain.model.Credential;

/**
 * 왜: 인증 시작, 콜백 처리, 연결 해제, 상태 조회를 하나의 진입점으로 모아 웹 계층이 토큰 저장 규칙을 몰라도 되게 하기 위함.
 */
public interface ConnectAccountUseCase {

    AuthorizationRedirect beginAuthorization(String accountKey);

    Credential completeAuthorization(String state, String authorizationCode);

    /**
     * 항상 성공한다.
     *
     * @return 해제 전에 연결되어 있었는지 여부
     */
    boolean disconnect(String accountKey);

    ConnectionStatus status(String accountKey);
}
