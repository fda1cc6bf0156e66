package com.demandplanner.forecast;

import com.demandplanner.domain.Feature;
import com.demandplanner.domain.FeatureRow;
import com.demandplanner.domain.WeeklySeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class FeatureBuilderTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final FeatureBuilder featureBuilder = new FeatureBuilder();

    @Test
    void build_keepsOneRowPerWeekAndMarksMissingHistoryAsNaN() {
        WeeklySeries series = WeeklySeries.starting(START, ramp(10));

        List<FeatureRow> rows = featureBuilder.build(series);

        assertThat(rows).hasSize(10);
        assertThat(rows.get(0).isMissing(Feature.LAG_1)).isTrue();
        assertThat(rows.get(1).get(Feature.LAG_1)).isEqualTo(1.0);
        assertThat(rows.get(9).get(Feature.LAG_8)).isEqualTo(2.0);
        assertThat(rows.get(9).isMissing(Feature.LAG_12)).isTrue();
        assertThat(rows.get(9).isMissing(Feature.YOY_CHANGE)).isTrue();
        assertThat(rows).noneMatch(FeatureRow::isComplete);
    }

    @Test
    void build_rollingWindowIncludesCurrentWeek() {
        WeeklySeries series = WeeklySeries.starting(START, 2, 4, 6, 8);

        FeatureRow last = featureBuilder.build(series).get(3);

        assertThat(last.get(Feature.ROLLING_MEAN_4)).isEqualTo(5.0);
        assertThat(last.get(Feature.ROLLING_STD_4)).isCloseTo(Math.sqrt(20.0 / 3.0), within(1e-9));
        assertThat(featureBuilder.build(series).get(2).isMissing(Feature.ROLLING_MEAN_4)).isTrue();
    }

    @Test
    void build_yearOverYearAndCalendarColumns() {
        WeeklySeries series = WeeklySeries.starting(START, ramp(60));

        FeatureRow row = featureBuilder.build(series).get(55);

        assertThat(row.get(Feature.YOY_CHANGE)).isEqualTo(52.0);
        assertThat(row.get(Feature.LAG_52)).isEqualTo(4.0);
        assertThat(row.get(Feature.TREND)).isEqualTo(55.0);
        assertThat(row.weekStart()).isEqualTo(START.plusWeeks(55));
        assertThat(row.get(Feature.MONTH)).isEqualTo(row.weekStart().getMonthValue());
        assertThat(row.get(Feature.QUARTER)).isEqualTo((row.weekStart().getMonthValue() - 1) / 3 + 1);
        assertThat(row.isComplete()).isTrue();
    }

    @Test
    void nextRow_readsLagsFromHistoryAndAdvancesCalendar() {
        WeeklySeries series = WeeklySeries.starting(START, ramp(60));

        FeatureRow next = featureBuilder.nextRow(series);
        FeatureRow last = featureBuilder.build(series).get(59);

        assertThat(next.weekStart()).isEqualTo(series.lastWeek().plusWeeks(1));
        assertThat(next.get(Feature.LAG_1)).isEqualTo(60.0);
        assertThat(next.get(Feature.LAG_52)).isEqualTo(9.0);
        assertThat(next.get(Feature.TREND)).isEqualTo(60.0);
        assertThat(next.get(Feature.ROLLING_MEAN_12)).isEqualTo(last.get(Feature.ROLLING_MEAN_12));
        assertThat(next.get(Feature.YOY_CHANGE)).isEqualTo(last.get(Feature.YOY_CHANGE));
        assertThat(Double.isNaN(next.target())).isTrue();
    }

    @Test
    void nextRow_emptySeries_throws() {
        assertThatThrownBy(() -> featureBuilder.nextRow(WeeklySeries.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[] ramp(int weeks) {
        return IntStream.rangeClosed(1, weeks).asDoubleStream().toArray();
    }
}
