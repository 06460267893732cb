package com.my.fitsync.adapter.out.clock;

import com.my.fitsync.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * 왜: 시스템 시간을 설정된 기준 시간대로 제공해 "어제" 계산이 서버 시간대에 따라 달라지지 않게 하기 위함.
 */
public class ZonedClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private ZonedClockAdapter(ZoneId zoneId) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
    }

    public static ZonedClockAdapter of(ZoneId zoneId) {
        return new ZonedClockAdapter(zoneId);
    }

    public ZoneId zone() {
        return zoneId;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
