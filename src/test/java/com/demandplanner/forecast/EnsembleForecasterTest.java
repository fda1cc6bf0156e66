package com.demandplanner.forecast;

import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.domain.WeeklySeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnsembleForecasterTest {

    private static final RecursionStrategy CARRY = RecursionStrategy.CARRY_FORWARD;

    @Mock SeasonalModelAdapter seasonalAdapter;
    @Mock TreeModelAdapter     treeAdapter;

    @InjectMocks EnsembleForecaster ensembleForecaster;

    private final WeeklySeries series = SeasonalModelAdapterTest.constant(60, 10.0);

    @Test
    void forecast_bothModels_blendsMeansAndUsesSeasonalInterval() {
        when(seasonalAdapter.forecast(any(), eq(2), any())).thenReturn(ModelForecast.withInterval(
            new double[]{10, 20}, new double[]{8, 15}, new double[]{12, 25}));
        when(treeAdapter.forecast(any(), eq(2), any())).thenReturn(ModelForecast.of(new double[]{20, 30}));

        EnsembleForecast result = ensembleForecaster.forecast(series, 2, SeasonalModelConfig.PRODUCT, CARRY);

        assertThat(result.method()).isEqualTo(ForecastMethod.ENSEMBLE);
        assertThat(result.points()).extracting(ForecastPoint::forecast).containsExactly(16.0, 26.0);
        assertThat(result.points().get(0).low()).isEqualTo(8.0);
        assertThat(result.points().get(0).high()).isEqualTo(16.0);
        assertThat(result.points().get(1).low()).isEqualTo(15.0);
        assertThat(result.points().get(1).high()).isEqualTo(26.0);
        assertThat(result.points().get(0).week()).isEqualTo(series.lastWeek().plusWeeks(1));
        assertThat(result.total()).isEqualTo(42.0);
    }

    @Test
    void forecast_treeOnly_usesTwentyPercentBand() {
        when(seasonalAdapter.forecast(any(), anyInt(), any())).thenReturn(ModelForecast.unavailable("no fit"));
        when(treeAdapter.forecast(any(), eq(3), any())).thenReturn(ModelForecast.of(new double[]{50, 25, 10}));

        EnsembleForecast result = ensembleForecaster.forecast(series, 3, SeasonalModelConfig.PRODUCT, CARRY);

        assertThat(result.method()).isEqualTo(ForecastMethod.TREE);
        assertThat(result.points()).hasSize(3).allSatisfy(point -> {
            assertThat(point.low()).isCloseTo(0.8 * point.forecast(), within(1e-9));
            assertThat(point.high()).isCloseTo(1.2 * point.forecast(), within(1e-9));
        });
    }

    @Test
    void forecast_seasonalOnly_keepsItsInterval() {
        when(seasonalAdapter.forecast(any(), eq(1), any())).thenReturn(ModelForecast.withInterval(
            new double[]{12.34}, new double[]{9.0}, new double[]{15.66}));
        when(treeAdapter.forecast(any(), eq(1), any())).thenReturn(ModelForecast.unavailable("too short"));

        EnsembleForecast result = ensembleForecaster.forecast(series, 1, SeasonalModelConfig.FABRIC, CARRY);

        assertThat(result.method()).isEqualTo(ForecastMethod.SEASONAL);
        assertThat(result.points()).singleElement().satisfies(point -> {
            assertThat(point.forecast()).isEqualTo(12.3);
            assertThat(point.low()).isEqualTo(9.0);
            assertThat(point.high()).isEqualTo(15.7);
        });
    }

    @Test
    void forecast_neitherModel_returnsEmpty() {
        when(seasonalAdapter.forecast(any(), anyInt(), any())).thenReturn(ModelForecast.unavailable("a"));
        when(treeAdapter.forecast(any(), anyInt(), any())).thenReturn(ModelForecast.unavailable("b"));

        EnsembleForecast result = ensembleForecaster.forecast(series, 4, SeasonalModelConfig.PRODUCT, CARRY);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.method()).isNull();
    }

    @Test
    void forecast_passesRecursionStrategyToTreeModel() {
        when(seasonalAdapter.forecast(any(), anyInt(), any())).thenReturn(ModelForecast.unavailable("no fit"));
        when(treeAdapter.forecast(any(), eq(2), eq(RecursionStrategy.RECOMPUTE)))
            .thenReturn(ModelForecast.of(new double[]{5, 6}));

        EnsembleForecast result = ensembleForecaster.forecast(series, 2, SeasonalModelConfig.PRODUCT,
            RecursionStrategy.RECOMPUTE);

        assertThat(result.points()).extracting(ForecastPoint::forecast).containsExactly(5.0, 6.0);
        verify(treeAdapter, never()).forecast(any(), anyInt(), eq(RecursionStrategy.CARRY_FORWARD));
    }

    @Test
    void forecast_negativeOutputs_areClampedAndIntervalStillContainsForecast() {
        when(seasonalAdapter.forecast(any(), eq(1), any())).thenReturn(ModelForecast.withInterval(
            new double[]{-5}, new double[]{-9}, new double[]{-1}));
        when(treeAdapter.forecast(any(), eq(1), any())).thenReturn(ModelForecast.of(new double[]{1}));

        ForecastPoint point = ensembleForecaster.forecast(series, 1, SeasonalModelConfig.PRODUCT, CARRY).points().get(0);

        assertThat(point.forecast()).isEqualTo(0.0);
        assertThat(point.low()).isEqualTo(0.0);
        assertThat(point.high()).isEqualTo(0.0);
    }

    @Test
    void forecast_emptySeries_skipsModels() {
        EnsembleForecast result = ensembleForecaster.forecast(WeeklySeries.empty(), 4, SeasonalModelConfig.PRODUCT, CARRY);

        assertThat(result.isEmpty()).isTrue();
        verifyNoInteractions(seasonalAdapter, treeAdapter);
    }
}
