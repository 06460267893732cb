package com.my.fitsync.adapter.in.web;

import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.model.AuthorizationRedirect;
import com.my.fitsync.domain.model.Credential;
import com.my.fitsync.domain.port.in.ConnectAccountUseCase;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * 왜: 사용자가 브라우저로 Fitbit 계정을 연결/해제하는 OAuth 흐름의 HTTP 진입점을 제공하기 위함.
 */
@Path("/fitbit")
@Produces(MediaType.APPLICATION_JSON)
public class FitbitAuthResource {

    private static final Logger log = Logger.getLogger(FitbitAuthResource.class);

    private final ConnectAccountUseCase connectAccountUseCase;
    private final String defaultAccountKey;

    @Inject
    public FitbitAuthResource(ConnectAccountUseCase connectAccountUseCase, AppConfig appConfig) {
        this(connectAccountUseCase, appConfig.sync().accountKey());
    }

    FitbitAuthResource(ConnectAccountUseCase connectAccountUseCase, String defaultAccountKey) {
        this.connectAccountUseCase = connectAccountUseCase;
        this.defaultAccountKey = defaultAccountKey;
    }

    @GET
    @Path("/authorize")
    public Response authorize(@QueryParam("accountKey") String accountKey) {
        AuthorizationRedirect redirect = connectAccountUseCase.beginAuthorization(orDefault(accountKey));
        log.infof("Fitbit 인증 시작: account=%s", redirect.accountKey());
        return Response.seeOther(redirect.uri()).build();
    }

    @GET
    @Path("/callback")
    public Response callback(@QueryParam("state") String state,
                             @QueryParam("code") String code,
                             @QueryParam("error") String error,
                             @QueryParam("error_description") String errorDescription) {
        if (error != null && !error.isBlank()) {
            log.warnf("Fitbit 인증 거부: error=%s", error);
            throw new InvalidRequestException("Fitbit 인증이 거부되었습니다: " + error
                    + (errorDescription == null ? "" : " (" + errorDescription + ")"));
        }
        Credential credential = connectAccountUseCase.completeAuthorization(state, code);
        log.infof("Fitbit 계정 연결 완료: account=%s user=%s", credential.accountKey(), credential.subjectId());
        return Response.ok(Map.of(
                "accountKey", credential.accountKey(),
                "subjectId", credential.subjectId(),
                "connected", true
        )).build();
    }

    @POST
    @Path("/disconnect")
    public Map<String, Object> disconnect(@QueryParam("accountKey") String accountKey) {
        String key = orDefault(accountKey);
        boolean existed = connectAccountUseCase.disconnect(key);
        log.infof("Fitbit 연결 해제: account=%s existed=%s", key, existed);
        return Map.of("accountKey", key, "disconnected", existed);
    }

    @GET
    @Path("/status")
    public ConnectionStatusResponse status(@QueryParam("accountKey") String accountKey) {
        return ConnectionStatusResponse.from(connectAccountUseCase.status(orDefault(accountKey)));
    }

    private String orDefault(String accountKey) {
        return accountKey == null || accountKey.isBlank() ? defaultAccountKey : accountKey.trim();
    }
}
