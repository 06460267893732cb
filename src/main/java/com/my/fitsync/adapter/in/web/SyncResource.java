package com.my.fitsync.adapter.in.web;

import com.my.fitsync.config.AppConfig;
import com.my.fitsync.domain.exception.InvalidRequestException;
import com.my.fitsync.domain.model.SyncReport;
import com.my.fitsync.domain.port.in.SyncUseCase;
import com.my.fitsync.domain.port.out.ResultStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

/**
 * 왜: 수동 동기화, 백필, 이력 조회를 HTTP 로 열어 스케줄 외의 시점에도 운영자가 동기화를 돌릴 수 있게 하기 위함.
 */
@Path("/sync")
@Produces(MediaType.APPLICATION_JSON)
public class SyncResource {

    private static final Logger log = Logger.getLogger(SyncResource.class);

    private final SyncUseCase syncUseCase;
    private final ResultStore resultStore;
    private final String defaultAccountKey;

    @Inject
    public SyncResource(SyncUseCase syncUseCase, ResultStore resultStore, AppConfig appConfig) {
        this(syncUseCase, resultStore, appConfig.sync().accountKey());
    }

    SyncResource(SyncUseCase syncUseCase, ResultStore resultStore, String defaultAccountKey) {
        this.syncUseCase = syncUseCase;
        this.resultStore = resultStore;
        this.defaultAccountKey = defaultAccountKey;
    }

    @POST
    public Response sync(@QueryParam("accountKey") String accountKey, @QueryParam("date") String date) {
        String key = orDefault(accountKey);
        LocalDate target = parseDate("date", date, false);
        MDC.put("correlationId", UUID.randomUUID().toString());
        MDC.put("accountKey", key);
        try {
            SyncReport report = syncUseCase.runSync(key, target);
            log.infof("수동 동기화 완료: date=%s status=%s", report.date(), report.status());
            SyncReportResponse body = SyncReportResponse.from(report);
            return Response.status(body.httpStatus()).entity(body).build();
        } finally {
            MDC.remove("correlationId");
            MDC.remove("accountKey");
        }
    }

    @POST
    @Path("/backfill")
    public List<SyncReportResponse> backfill(@QueryParam("accountKey") String accountKey,
                                             @QueryParam("from") String from,
                                             @QueryParam("to") String to,
                                             @QueryParam("skipExisting") @DefaultValue("true") boolean skipExisting) {
        String key = orDefault(accountKey);
        MDC.put("correlationId", UUID.randomUUID().toString());
        MDC.put("accountKey", key);
        try {
            List<SyncReport> reports = syncUseCase.backfill(key, parseDate("from", from, true), parseDate("to", to, true), skipExisting);
            log.infof("백필 완료: from=%s to=%s days=%d", from, to, reports.size());
            return reports.stream().map(SyncReportResponse::from).toList();
        } finally {
            MDC.remove("correlationId");
            MDC.remove("accountKey");
        }
    }

    @GET
    @Path("/history")
    public List<ArtifactResponse> history(@QueryParam("accountKey") String accountKey) {
        return resultStore.history(orDefault(accountKey)).stream()
                .map(ArtifactResponse::from)
                .toList();
    }

    private static LocalDate parseDate(String name, String value, boolean required) {
        if (value == null || value.isBlank()) {
            if (required) {
                throw new InvalidRequestException(name + " 날짜가 필요합니다(yyyy-MM-dd).");
            }
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(name + " 날짜 형식이 올바르지 않습니다(yyyy-MM-dd): " + value, e);
        }
    }

    private String orDefault(String accountKey) {
        return accountKey == null || accountKey.isBlank() ? defaultAccountKey : accountKey.trim();
    }
}
