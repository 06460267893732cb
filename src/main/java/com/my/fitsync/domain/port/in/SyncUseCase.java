package com.my.fitsync.domain.port.in;

import com.my.fitsync.domain.model.SyncReport;

import java.time.LocalDate;
import java.util.List;

public interface SyncUseCase {

    /**
     * 기준 시간대의 어제 날짜로 동기화한다.
     */
    SyncReport runSync(String accountKey);

    /**
     * @param targetDate null 이면 어제
     */
    SyncReport runSync(String accountKey, LocalDate targetDate);

    List<SyncReport> backfill(String accountKey, LocalDate from, LocalDate to, boolean skipExisting);
}
