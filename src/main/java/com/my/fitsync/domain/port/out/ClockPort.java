package com.my.fitsync.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간과 기준 시간대를 주입형으로 분리하여 만료 판단과 "어제" 계산을 테스트에서 고정할 수 있게 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();
}
