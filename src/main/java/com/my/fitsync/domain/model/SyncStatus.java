package com.my.fitsync.domain.model;

public enum SyncStatus {
    SUCCEEDED,
    PARTIAL,
    FAILED,
    NOT_CONNECTED
}
