package com.demandplanner.forecast;

import com.demandplanner.domain.WeeklySeries;
import com.demandplanner.forecast.arima.ArimaModel;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class SeasonalModelAdapterTest {

    private final SeasonalModelAdapter adapter = new SeasonalModelAdapter();

    @Test
    void forecast_shortSeriesWithSeasonalConfig_fallsBackToNonSeasonalFit() {
        WeeklySeries series = constant(52, 10.0);

        ModelForecast forecast = adapter.forecast(series, 4, SeasonalModelConfig.PRODUCT);

        assertThat(forecast.isAvailable()).isTrue();
        assertThat(forecast.steps()).isEqualTo(4);
        for (int h = 0; h < 4; h++) {
            assertThat(forecast.mean(h)).isCloseTo(10.0, within(1e-6));
            assertThat(forecast.lower(h)).isLessThanOrEqualTo(forecast.mean(h) + 1e-9);
            assertThat(forecast.upper(h)).isGreaterThanOrEqualTo(forecast.mean(h) - 1e-9);
        }
    }

    @Test
    void forecast_tooShortForAnyFit_isUnavailableInsteadOfThrowing() {
        ModelForecast forecast = adapter.forecast(constant(10, 3.0), 4, SeasonalModelConfig.FABRIC);

        assertThat(forecast.isAvailable()).isFalse();
        assertThat(forecast.steps()).isZero();
        assertThat(forecast.reason()).contains("insufficient history");
    }

    @Test
    void forecast_fabricConfig_producesIntervalAroundMean() {
        double[] values = wave(40, 20.0, 5.0, 13);
        double seriesMean = Arrays.stream(values).average().orElseThrow();

        ModelForecast forecast = adapter.forecast(
            WeeklySeries.starting(LocalDate.of(2024, 1, 1), values), 8, SeasonalModelConfig.FABRIC);

        assertThat(forecast.isAvailable()).isTrue();
        assertThat(forecast.hasInterval()).isTrue();
        assertThat(forecast.steps()).isEqualTo(8);
        for (int h = 0; h < 8; h++) {
            assertThat(forecast.lower(h)).isLessThanOrEqualTo(forecast.mean(h));
            assertThat(forecast.upper(h)).isGreaterThanOrEqualTo(forecast.mean(h));
            assertThat(forecast.mean(h)).isCloseTo(seriesMean, within(3.0));
        }
        assertThat(forecast.upper(7) - forecast.lower(7))
            .isGreaterThan(forecast.upper(0) - forecast.lower(0));
    }

    @Test
    void forecast_productConfigWithThreeYears_repeatsLastYearsSeasonalShape() {
        double[] values = wave(160, 50.0, 20.0, 52);
        assertThat(values.length).isGreaterThanOrEqualTo(ArimaModel.minimumLength(SeasonalModelConfig.PRODUCT));

        ModelForecast forecast = adapter.forecast(
            WeeklySeries.starting(LocalDate.of(2023, 1, 2), values), 52, SeasonalModelConfig.PRODUCT);

        assertThat(forecast.isAvailable()).isTrue();
        assertThat(forecast.steps()).isEqualTo(52);
        double[] lastYear = Arrays.copyOfRange(values, values.length - 52, values.length);
        double[] mean = new double[52];
        for (int h = 0; h < 52; h++) {
            mean[h] = forecast.mean(h);
            assertThat(mean[h]).isCloseTo(lastYear[h], within(3.0));
        }
        assertThat(argMax(mean)).isCloseTo(argMax(lastYear), within(2));
        assertThat(argMin(mean)).isCloseTo(argMin(lastYear), within(2));
        assertThat(mean[argMax(mean)] - mean[argMin(mean)]).isGreaterThan(30.0);
    }

    @Test
    void forecast_productConfigBelowSeasonalMinimum_matchesNonSeasonalFit() {
        double[] values = wave(80, 50.0, 20.0, 52);
        assertThat(values.length).isLessThan(ArimaModel.minimumLength(SeasonalModelConfig.PRODUCT));

        ModelForecast forecast = adapter.forecast(
            WeeklySeries.starting(LocalDate.of(2023, 1, 2), values), 8, SeasonalModelConfig.PRODUCT);
        ModelForecast nonSeasonal = ArimaModel.fit(values, SeasonalModelConfig.PRODUCT.withoutSeasonal()).forecast(8);

        assertThat(forecast.isAvailable()).isTrue();
        assertThat(forecast.steps()).isEqualTo(8);
        for (int h = 0; h < 8; h++) {
            assertThat(forecast.mean(h)).isEqualTo(nonSeasonal.mean(h));
            assertThat(forecast.lower(h)).isEqualTo(nonSeasonal.lower(h));
            assertThat(forecast.upper(h)).isEqualTo(nonSeasonal.upper(h));
        }
    }

    // sinusoid with a fixed saw-tooth jitter so fits are reproducible
    private static double[] wave(int weeks, double level, double amplitude, int period) {
        double[] values = new double[weeks];
        for (int i = 0; i < weeks; i++) {
            double jitter = ((i * 37) % 11 - 5) * 0.4;
            values[i] = level + amplitude * Math.sin(2 * Math.PI * i / period) + jitter;
        }
        return values;
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    private static int argMin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) {
                best = i;
            }
        }
        return best;
    }

    static WeeklySeries constant(int weeks, double value) {
        double[] values = new double[weeks];
        Arrays.fill(values, value);
        return WeeklySeries.starting(LocalDate.of(2024, 1, 1), values);
    }
}
