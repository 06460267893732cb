package com.my.fitsync.domain.model;

import com.my.fitsync.domain.exception.InvalidRequestException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 왜: 수집 대상 지표를 이름과 엔드포인트 규칙 한 쌍으로 묶어 새 지표를 코드 변경 없이 목록에 추가할 수 있게 하기 위함.
 */
public record MetricKind(String name, MetricType type, String resourcePath, String detailLevel) {

    private static final Pattern NAME = Pattern.compile("[a-z0-9-]+");

    public static final MetricKind STEPS =
            new MetricKind("steps", MetricType.DAILY, "/1/user/-/activities/steps/date/{date}/1d.json", null);
    public static final MetricKind HEART_RATE_INTRADAY =
            new MetricKind("heartrate-intraday", MetricType.INTRADAY, "/1/user/-/activities/heart/date/{date}/1d/{detail}.json", "1min");
    public static final MetricKind STEPS_INTRADAY =
            new MetricKind("steps-intraday", MetricType.INTRADAY, "/1/user/-/activities/steps/date/{date}/1d/{detail}.json", "1min");
    public static final MetricKind SLEEP =
            new MetricKind("sleep", MetricType.DAILY, "/1.2/user/-/sleep/date/{date}.json", null);

    private static final Map<String, MetricKind> CATALOG = catalog(STEPS, HEART_RATE_INTRADAY, STEPS_INTRADAY, SLEEP);

    public MetricKind {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resourcePath, "resourcePath");
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("지표 이름 형식이 올바르지 않습니다: " + name);
        }
        if (type == MetricType.INTRADAY && (detailLevel == null || detailLevel.isBlank())) {
            throw new IllegalArgumentException("intraday 지표에는 detailLevel 이 필요합니다: " + name);
        }
    }

    public String pathFor(LocalDate date) {
        String path = resourcePath.replace("{date}", DateTimeFormatter.ISO_LOCAL_DATE.format(date));
        return detailLevel == null ? path : path.replace("{detail}", detailLevel);
    }

    public static MetricKind named(String name) {
        MetricKind kind = CATALOG.get(name == null ? "" : name.trim());
        if (kind == null) {
            throw new InvalidRequestException("알 수 없는 지표입니다: " + name + " (지원: " + CATALOG.keySet() + ")");
        }
        return kind;
    }

    public static List<MetricKind> resolve(Collection<String> names) {
        List<MetricKind> kinds = new ArrayList<>();
        for (String name : names) {
            MetricKind kind = named(name);
            if (!kinds.contains(kind)) {
                kinds.add(kind);
            }
        }
        if (kinds.isEmpty()) {
            throw new InvalidRequestException("수집할 지표가 하나 이상 필요합니다.");
        }
        return List.copyOf(kinds);
    }

    private static Map<String, MetricKind> catalog(MetricKind... kinds) {
        Map<String, MetricKind> byName = new LinkedHashMap<>();
        for (MetricKind kind : kinds) {
            byName.put(kind.name(), kind);
        }
        return Collections.unmodifiableMap(byName);
    }
}
