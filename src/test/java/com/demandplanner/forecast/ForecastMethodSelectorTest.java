package com.demandplanner.forecast;

import com.demandplanner.config.PlanningConfig;
import com.demandplanner.domain.ForecastMethod;
import com.demandplanner.domain.ForecastPoint;
import com.demandplanner.domain.SeriesForecast;
import com.demandplanner.domain.WeeklySeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastMethodSelectorTest {

    @Mock EnsembleForecaster ensembleForecaster;

    @InjectMocks ForecastMethodSelector selector;

    private final PlanningConfig config = PlanningConfig.defaults().withHorizonWeeks(4);

    @Test
    void select_inactiveShortHistory_isSkipped() {
        WeeklySeries series = WeeklySeries.starting(LocalDate.of(2025, 1, 6), 0, 0, 0);

        assertThat(selector.select(series, config, SeasonalModelConfig.PRODUCT)).isEmpty();
        verifyNoInteractions(ensembleForecaster);
    }

    @Test
    void select_fewActiveWeeksInTrailingWindow_isSkipped() {
        double[] values = new double[40];
        values[36] = 5;
        values[38] = 5;
        values[39] = 5;

        Optional<SeriesForecast> result = selector.select(
            WeeklySeries.starting(LocalDate.of(2024, 1, 1), values), config, SeasonalModelConfig.PRODUCT);

        assertThat(result).isEmpty();
    }

    @Test
    void select_shortActiveHistory_usesFlatTrailingAverage() {
        WeeklySeries series = WeeklySeries.starting(LocalDate.of(2025, 1, 6), 4, 6, 5, 5, 3, 7);

        SeriesForecast forecast = selector.select(series, config, SeasonalModelConfig.PRODUCT).orElseThrow();

        assertThat(forecast.method()).isEqualTo(ForecastMethod.AVERAGE_FALLBACK);
        assertThat(forecast.points()).hasSize(4).allSatisfy(point -> {
            assertThat(point.forecast()).isEqualTo(5.0);
            assertThat(point.low()).isEqualTo(5.0);
            assertThat(point.high()).isEqualTo(5.0);
        });
        assertThat(forecast.points().get(0).week()).isEqualTo(series.lastWeek().plusWeeks(1));
        assertThat(forecast.total()).isEqualTo(20.0);
        verifyNoInteractions(ensembleForecaster);
    }

    @Test
    void select_longHistory_usesEnsemble() {
        WeeklySeries series = SeasonalModelAdapterTest.constant(40, 10.0);
        List<ForecastPoint> points = List.of(new ForecastPoint(series.lastWeek().plusWeeks(1), 11.0, 9.0, 13.0));
        when(ensembleForecaster.forecast(series, 4, SeasonalModelConfig.PRODUCT, RecursionStrategy.CARRY_FORWARD))
            .thenReturn(new EnsembleForecast(points, ForecastMethod.ENSEMBLE));

        SeriesForecast forecast = selector.select(series, config, SeasonalModelConfig.PRODUCT).orElseThrow();

        assertThat(forecast.method()).isEqualTo(ForecastMethod.ENSEMBLE);
        assertThat(forecast.points()).isEqualTo(points);
        assertThat(forecast.total()).isEqualTo(11.0);
    }

    @Test
    void select_usesRecursionStrategyOfTheRun() {
        WeeklySeries series = SeasonalModelAdapterTest.constant(40, 10.0);
        when(ensembleForecaster.forecast(any(), anyInt(), any(), any())).thenReturn(EnsembleForecast.empty());

        selector.select(series, config.withRecursionStrategy(RecursionStrategy.RECOMPUTE), SeasonalModelConfig.FABRIC);

        verify(ensembleForecaster).forecast(series, 4, SeasonalModelConfig.FABRIC, RecursionStrategy.RECOMPUTE);
    }

    @Test
    void select_emptyEnsemble_fallsBackToAverage() {
        WeeklySeries series = SeasonalModelAdapterTest.constant(40, 10.0);
        when(ensembleForecaster.forecast(any(), anyInt(), any(), any())).thenReturn(EnsembleForecast.empty());

        SeriesForecast forecast = selector.select(series, config, SeasonalModelConfig.PRODUCT).orElseThrow();

        assertThat(forecast.method()).isEqualTo(ForecastMethod.AVERAGE_FALLBACK);
        assertThat(forecast.total()).isEqualTo(40.0);
    }

    @Test
    void averageOnly_longHistory_neverCallsEnsemble() {
        SeriesForecast forecast = selector.averageOnly(SeasonalModelAdapterTest.constant(40, 2.5), config)
            .orElseThrow();

        assertThat(forecast.method()).isEqualTo(ForecastMethod.AVERAGE_FALLBACK);
        assertThat(forecast.total()).isEqualTo(10.0);
        verifyNoInteractions(ensembleForecaster);
    }
}
