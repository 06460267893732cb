package com.my.fitsync.domain.model;

public enum MetricType {
    DAILY,
    INTRADAY
}
