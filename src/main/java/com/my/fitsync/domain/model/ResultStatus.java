package com.my.fitsync.domain.model;

public enum ResultStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
