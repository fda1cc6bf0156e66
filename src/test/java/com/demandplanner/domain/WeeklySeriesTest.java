package com.demandplanner.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WeeklySeriesTest {

    @Test
    void of_normalizesToMondayAndSumsSameWeek() {
        Map<LocalDate, Integer> observations = new LinkedHashMap<>();
        observations.put(LocalDate.of(2025, 1, 8), 3);   // Wednesday
        observations.put(LocalDate.of(2025, 1, 12), 4);  // Sunday, same ISO week
        observations.put(LocalDate.of(2025, 1, 13), 5);  // next Monday

        WeeklySeries series = WeeklySeries.of(observations);

        assertThat(series.weeks()).containsExactly(LocalDate.of(2025, 1, 6), LocalDate.of(2025, 1, 13));
        assertThat(series.values()).containsExactly(7.0, 5.0);
    }

    @Test
    void of_forwardFillsMissingWeeks() {
        WeeklySeries series = WeeklySeries.of(Map.of(
            LocalDate.of(2025, 1, 6), 10,
            LocalDate.of(2025, 1, 27), 4));

        assertThat(series.size()).isEqualTo(4);
        assertThat(series.values()).containsExactly(10.0, 10.0, 10.0, 4.0);
        for (int i = 1; i < series.size(); i++) {
            assertThat(series.weekAt(i)).isEqualTo(series.weekAt(i - 1).plusWeeks(1));
        }
    }

    @Test
    void of_emptyObservations_returnsEmptySeries() {
        assertThat(WeeklySeries.of(Map.of()).isEmpty()).isTrue();
    }

    @Test
    void trailingStatistics_useOnlyLastWeeks() {
        WeeklySeries series = WeeklySeries.starting(LocalDate.of(2025, 1, 6),
            100, 100, 0, 2, 0, 4, 0, 6, 0, 8);

        assertThat(series.activeWeeks(8)).isEqualTo(4);
        assertThat(series.trailingMean(8)).isCloseTo(2.5, within(1e-9));
        assertThat(series.tail(3).values()).containsExactly(6.0, 0.0, 8.0);
    }

    @Test
    void append_addsFollowingWeek() {
        WeeklySeries series = WeeklySeries.starting(LocalDate.of(2025, 3, 5), 1, 2);

        WeeklySeries extended = series.append(3);

        assertThat(series.size()).isEqualTo(2);
        assertThat(extended.lastWeek()).isEqualTo(LocalDate.of(2025, 3, 17));
        assertThat(extended.lastValue()).isEqualTo(3.0);
    }

    @Test
    void append_emptySeries_throws() {
        assertThatThrownBy(() -> WeeklySeries.empty().append(1.0))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void trimEnds_dropsFirstAndLastWeek() {
        WeeklySeries series = WeeklySeries.starting(LocalDate.of(2025, 1, 6), 1, 2, 3, 4);

        assertThat(series.trimEnds().values()).containsExactly(2.0, 3.0);
        assertThat(WeeklySeries.starting(LocalDate.of(2025, 1, 6), 1, 2).trimEnds().size()).isEqualTo(2);
    }
}
