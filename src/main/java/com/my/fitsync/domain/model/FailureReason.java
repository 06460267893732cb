package com.my.fitsync.domain.model;

public enum FailureReason {
    UNAUTHORIZED,
    RATE_LIMITED,
    FORBIDDEN,
    TRANSPORT,
    MALFORMED_RESPONSE,
    STORAGE,
    NOT_CONNECTED,
    AUTH_UNAVAILABLE,
    CANCELLED
}
