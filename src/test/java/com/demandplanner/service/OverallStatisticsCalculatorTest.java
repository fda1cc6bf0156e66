package com.demandplanner.service;

import com.demandplanner.data.PlanningDataSource.WeeklyTotal;
import com.demandplanner.dto.DemandForecastResponse;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OverallStatisticsCalculatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final OverallStatisticsCalculator calculator = new OverallStatisticsCalculator();

    @Test
    void trimPartialWeeks_sortsAndDropsBothEnds() {
        List<WeeklyTotal> totals = List.of(week(2, 20), week(0, 1), week(3, 2), week(1, 10));

        List<WeeklyTotal> trimmed = calculator.trimPartialWeeks(totals);

        assertThat(trimmed).extracting(WeeklyTotal::orders).containsExactly(10L, 20L);
        assertThat(calculator.trimPartialWeeks(List.of(week(0, 5), week(1, 6)))).hasSize(2);
    }

    @Test
    void stats_comparesRecentAndPreviousTwelveWeeks() {
        List<WeeklyTotal> weeks = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            weeks.add(new WeeklyTotal(START.plusWeeks(i), i < 12 ? 10 : 20, null, 0, i < 12 ? 40.0 : 60.0));
        }

        DemandForecastResponse.OverallStats stats = calculator.stats(weeks);

        assertThat(stats.getTotalOrders()).isEqualTo(360L);
        assertThat(stats.getWeeksOfData()).isEqualTo(24);
        assertThat(stats.getRecent12wAvg()).isEqualTo(20.0);
        assertThat(stats.getPrev12wAvg()).isEqualTo(10.0);
        assertThat(stats.getRecentAov()).isEqualTo(60.0);
        assertThat(stats.getPrevAov()).isEqualTo(40.0);
        assertThat(stats.getYoySamePeriodAvg()).isNull();
        assertThat(stats.getDateRange().getFrom()).isEqualTo(START);
        assertThat(stats.getDateRange().getTo()).isEqualTo(START.plusWeeks(23));
        assertThat(stats.getSeasonality()).hasSize(12);
        assertThat(stats.getSeasonality().get(11).getIndex()).isZero();
    }

    @Test
    void stats_yearOverYearWindowNeedsMoreThanFiftySixWeeks() {
        List<WeeklyTotal> weeks = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            weeks.add(week(i, i < 12 ? 7 : 1));
        }

        // weeks 4..11 of 60 fall in the window 56..48 weeks back
        assertThat(calculator.stats(weeks).getYoySamePeriodAvg()).isEqualTo(7.0);
    }

    @Test
    void stats_noWeeks_returnsEmptyStats() {
        DemandForecastResponse.OverallStats stats = calculator.stats(List.of());

        assertThat(stats.getWeeksOfData()).isZero();
        assertThat(stats.getDateRange()).isNull();
        assertThat(stats.getSeasonality()).isEmpty();
    }

    @Test
    void history_keepsLastFiftyTwoWeeksAndRounds() {
        List<WeeklyTotal> weeks = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            weeks.add(new WeeklyTotal(START.plusWeeks(i), i, 1234.56, 1, null));
        }

        List<DemandForecastResponse.WeekHistory> history = calculator.history(weeks);

        assertThat(history).hasSize(52);
        assertThat(history.get(0).getOrders()).isEqualTo(8L);
        assertThat(history.get(0).getRevenue()).isEqualTo(1235.0);
        assertThat(history.get(0).getAov()).isZero();
    }

    private static WeeklyTotal week(int offset, long orders) {
        return new WeeklyTotal(START.plusWeeks(offset), orders, orders * 50.0, orders, 50.0);
    }
}
