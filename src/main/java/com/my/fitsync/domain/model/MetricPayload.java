package com.my.fitsync.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 왜: 공급자 응답을 해석하지 않은 JSON 문서로 보관해 응답 구조 변경이 수집 계층에 번지지 않도록 하기 위함.
 */
public record MetricPayload(String json, boolean noData) {

    private static final String EMPTY_DOCUMENT = "{}";

    public MetricPayload {
        Objects.requireNonNull(json, "json");
    }

    public static MetricPayload of(String json) {
        return new MetricPayload(json, false);
    }

    public static MetricPayload empty() {
        return new MetricPayload(EMPTY_DOCUMENT, true);
    }

    public byte[] bytes() {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
