package com.my.fitsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.fitsync.domain.exception.InvalidRequestException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * accountKey 가 없으면 기본 계정, date 가 없으면 어제로 동기화한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingSyncRequest(String requestId,
                                  String accountKey,
                                  String date) {

    public IncomingSyncRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new InvalidRequestException("requestId 가 비어 있습니다.");
        }
    }

    public SyncCommand toCommand(String defaultAccountKey) {
        String key = accountKey == null || accountKey.isBlank() ? defaultAccountKey : accountKey.trim();
        LocalDate target;
        try {
            target = date == null || date.isBlank() ? null : LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("date 형식이 올바르지 않습니다(yyyy-MM-dd): " + date, e);
        }
        return new SyncCommand(requestId, key, target);
    }

    public record SyncCommand(String requestId, String accountKey, LocalDate date) {
    }
}
