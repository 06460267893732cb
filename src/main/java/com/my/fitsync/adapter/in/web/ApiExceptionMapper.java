package com.my.fitsync.adapter.in.web;

import com.my.fitsync.domain.exception.AuthorizationException;
import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.exception.NotConnectedException;
import com.my.fitsync.domain.exception.StorageException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * 왜: 도메인 예외를 HTTP 상태 코드로 옮기는 규칙을 한곳에 두어 리소스 메서드가 예외 처리 분기를 갖지 않게 하기 위함.
 */
@Provider
public class ApiExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(ApiExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException exception) {
        if (exception instanceof WebApplicationException) {
            return ((WebApplicationException) exception).getResponse();
        }
        if (exception instanceof InvalidRequestException) {
            return error(Response.Status.BAD_REQUEST, "invalid_request", exception.getMessage());
        }
        if (exception instanceof NotConnectedException) {
            return error(Response.Status.CONFLICT, "not_connected", exception.getMessage());
        }
        if (exception instanceof AuthorizationException) {
            log.warnf("인가 서버 호출 실패(terminal=%s): %s", ((AuthorizationException) exception).terminal(), exception.getMessage());
            return error(Response.Status.BAD_GATEWAY, "authorization_failed", exception.getMessage());
        }
        if (exception instanceof StorageException) {
            log.errorf(exception, "저장소 오류: %s", exception.getMessage());
            return error(Response.Status.INTERNAL_SERVER_ERROR, "storage_error", exception.getMessage());
        }
        log.errorf(exception, "처리되지 않은 예외: %s", exception.getMessage());
        return error(Response.Status.INTERNAL_SERVER_ERROR, "internal_error", "내부 오류가 발생했습니다.");
    }

    private static Response error(Response.Status status, String code, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(code, message))
                .build();
    }
}
