package com.my.fitsync.adapter.in.web;

import com.my.fitsync.domain.model.ConnectionStatus;

import java.time.Instant;
import java.util.List;

public record ConnectionStatusResponse(String accountKey,
                                       boolean connected,
                                       String subjectId,
                                       Instant expiresAt,
                                       List<String> scopes,
                                       Instant updatedAt) {

    public static ConnectionStatusResponse from(ConnectionStatus status) {
        return new ConnectionStatusResponse(
                status.accountKey(),
                status.connected(),
                status.subjectId(),
                status.expiresAt(),
                status.scopes().stream().sorted().toList(),
                status.updatedAt()
        );
    }
}
