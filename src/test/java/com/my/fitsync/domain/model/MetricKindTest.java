package com.my.fitsync.domain.model;

import com.my.fitsync.domain.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricKindTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 9);

    @Test
    void buildsDailyAndIntradayPaths() {
        assertThat(MetricKind.STEPS.pathFor(DATE))
                .isEqualTo("/1/user/-/activities/steps/date/2026-03-09/1d.json");
        assertThat(MetricKind.HEART_RATE_INTRADAY.pathFor(DATE))
                .isEqualTo("/1/user/-/activities/heart/date/2026-03-09/1d/1min.json");
        assertThat(MetricKind.SLEEP.pathFor(DATE))
                .isEqualTo("/1.2/user/-/sleep/date/2026-03-09.json");
    }

    @Test
    void resolvesNamesInOrderWithoutDuplicates() {
        List<MetricKind> kinds = MetricKind.resolve(List.of("heartrate-intraday", " steps", "heartrate-intraday"));

        assertThat(kinds).containsExactly(MetricKind.HEART_RATE_INTRADAY, MetricKind.STEPS);
    }

    @Test
    void rejectsUnknownOrEmptyNames() {
        assertThatThrownBy(() -> MetricKind.named("weight"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("weight");
        assertThatThrownBy(() -> MetricKind.resolve(List.of()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void intradayKindRequiresDetailLevel() {
        assertThatThrownBy(() -> new MetricKind("calories-intraday", MetricType.INTRADAY, "/x/{date}.json", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
