package com.demandplanner.forecast.arima;

import com.demandplanner.forecast.ModelFitException;
import com.demandplanner.forecast.ModelForecast;
import com.demandplanner.forecast.SeasonalModelConfig;

/**
 * Multiplicative seasonal ARIMA estimated by conditional sum of squares.
 * <p>
 * The AR side is kept as one expanded polynomial {@code c(B) = phi(B) Phi(B^s) (1-B)^d (1-B^s)^D},
 * so the model reads {@code c(B) y_t = theta(B) e_t}. Coefficients are optimized in an
 * unconstrained space and mapped into (-1, 1) with {@code tanh}.
 */
public final class ArimaModel {

    public static final int MIN_RESIDUALS = 10;

    private final SeasonalModelConfig config;
    private final double[] series;
    private final double[] arPolynomial;
    private final double[] maCoefficients;
    private final double[] residuals;
    private final double sigma2;

    private ArimaModel(SeasonalModelConfig config, double[] series, double[] arPolynomial,
                       double[] maCoefficients, double[] residuals, double sigma2) {
        this.config = config;
        this.series = series;
        this.arPolynomial = arPolynomial;
        this.maCoefficients = maCoefficients;
        this.residuals = residuals;
        this.sigma2 = sigma2;
    }

    public static int minimumLength(SeasonalModelConfig config) {
        return config.arDegree() + MIN_RESIDUALS + config.parameterCount();
    }

    /**
     * @throws ModelFitException when the series is too short, the objective is not finite or
     *                           the simplex does not converge within the iteration cap
     */
    public static ArimaModel fit(double[] series, SeasonalModelConfig config) {
        if (series.length < minimumLength(config)) {
            throw new ModelFitException("insufficient history: " + series.length
                + " weeks, " + minimumLength(config) + " required for " + config.name());
        }
        for (double value : series) {
            if (!Double.isFinite(value)) {
                throw new ModelFitException("series contains non-finite values");
            }
        }

        double[] differencing = differencingPolynomial(config);
        NelderMeadOptimizer optimizer = new NelderMeadOptimizer(config.maxIterations());
        NelderMeadOptimizer.Result result = optimizer.minimize(
            raw -> meanSquaredResidual(series, config, differencing, raw),
            new double[config.parameterCount()]);

        if (!Double.isFinite(result.value())) {
            throw new ModelFitException("objective is not finite");
        }
        if (!result.converged()) {
            throw new ModelFitException("no convergence within " + config.maxIterations() + " iterations");
        }

        double[] params = constrain(result.point());
        double[] arPolynomial = arPolynomial(config, differencing, params);
        double[] ma = maCoefficients(config, params);
        double[] residuals = residuals(series, arPolynomial, ma);
        int effective = series.length - (arPolynomial.length - 1);
        double sse = 0.0;
        for (int t = arPolynomial.length - 1; t < series.length; t++) {
            sse += residuals[t] * residuals[t];
        }
        double sigma2 = sse / effective;
        if (!Double.isFinite(sigma2)) {
            throw new ModelFitException("residual variance is not finite");
        }
        return new ArimaModel(config, series.clone(), arPolynomial, ma, residuals, sigma2);
    }

    public ModelForecast forecast(int steps) {
        int n = series.length;
        int degree = arPolynomial.length - 1;
        double[] extended = new double[n + steps];
        System.arraycopy(series, 0, extended, 0, n);
        double[] errors = new double[n + steps];
        System.arraycopy(residuals, 0, errors, 0, n);

        double[] mean = new double[steps];
        for (int h = 0; h < steps; h++) {
            int t = n + h;
            double value = 0.0;
            for (int k = 1; k <= degree; k++) {
                value -= arPolynomial[k] * extended[t - k];
            }
            for (int j = 1; j <= maCoefficients.length; j++) {
                value += maCoefficients[j - 1] * errors[t - j];
            }
            extended[t] = value;
            mean[h] = value;
        }

        double[] psi = psiWeights(steps);
        double z = NormalDistribution.inverseCdf(1.0 - config.alpha() / 2.0);
        double[] lower = new double[steps];
        double[] upper = new double[steps];
        double cumulative = 0.0;
        for (int h = 0; h < steps; h++) {
            cumulative += psi[h] * psi[h];
            double halfWidth = z * Math.sqrt(sigma2 * cumulative);
            if (!Double.isFinite(halfWidth) || !Double.isFinite(mean[h])) {
                throw new ModelFitException("forecast variance is not finite at step " + (h + 1));
            }
            lower[h] = mean[h] - halfWidth;
            upper[h] = mean[h] + halfWidth;
        }
        return ModelForecast.withInterval(mean, lower, upper);
    }

    public SeasonalModelConfig config() {
        return config;
    }

    public double sigma2() {
        return sigma2;
    }

    private double[] psiWeights(int count) {
        int degree = arPolynomial.length - 1;
        double[] psi = new double[count];
        psi[0] = 1.0;
        for (int j = 1; j < count; j++) {
            double value = j <= maCoefficients.length ? maCoefficients[j - 1] : 0.0;
            for (int k = 1; k <= Math.min(j, degree); k++) {
                value -= arPolynomial[k] * psi[j - k];
            }
            psi[j] = value;
        }
        return psi;
    }

    private static double meanSquaredResidual(double[] series, SeasonalModelConfig config,
                                              double[] differencing, double[] raw) {
        double[] params = constrain(raw);
        double[] arPolynomial = arPolynomial(config, differencing, params);
        double[] residuals = residuals(series, arPolynomial, maCoefficients(config, params));
        int start = arPolynomial.length - 1;
        double sse = 0.0;
        for (int t = start; t < series.length; t++) {
            sse += residuals[t] * residuals[t];
        }
        double value = sse / (series.length - start);
        return Double.isFinite(value) ? value : Double.POSITIVE_INFINITY;
    }

    private static double[] residuals(double[] series, double[] arPolynomial, double[] ma) {
        int degree = arPolynomial.length - 1;
        double[] residuals = new double[series.length];
        for (int t = degree; t < series.length; t++) {
            double e = 0.0;
            for (int k = 0; k <= degree; k++) {
                e += arPolynomial[k] * series[t - k];
            }
            for (int j = 1; j <= ma.length && t - j >= degree; j++) {
                e -= ma[j - 1] * residuals[t - j];
            }
            residuals[t] = e;
        }
        return residuals;
    }

    private static double[] constrain(double[] raw) {
        double[] params = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            params[i] = Math.tanh(raw[i]);
        }
        return params;
    }

    // parameter layout: [ar..., ma..., seasonal ar...]
    private static double[] arPolynomial(SeasonalModelConfig config, double[] differencing, double[] params) {
        double[] ar = new double[config.ar() + 1];
        ar[0] = 1.0;
        for (int i = 1; i <= config.ar(); i++) {
            ar[i] = -params[i - 1];
        }
        double[] seasonal = new double[config.seasonalAr() * config.period() + 1];
        seasonal[0] = 1.0;
        for (int i = 1; i <= config.seasonalAr(); i++) {
            seasonal[i * config.period()] = -params[config.ar() + config.ma() + i - 1];
        }
        return multiply(multiply(ar, seasonal), differencing);
    }

    private static double[] maCoefficients(SeasonalModelConfig config, double[] params) {
        double[] ma = new double[config.ma()];
        System.arraycopy(params, config.ar(), ma, 0, config.ma());
        return ma;
    }

    private static double[] differencingPolynomial(SeasonalModelConfig config) {
        double[] result = {1.0};
        for (int i = 0; i < config.differences(); i++) {
            result = multiply(result, new double[]{1.0, -1.0});
        }
        double[] seasonalDifference = new double[config.period() + 1];
        seasonalDifference[0] = 1.0;
        seasonalDifference[config.period()] = -1.0;
        for (int i = 0; i < config.seasonalDifferences(); i++) {
            result = multiply(result, seasonalDifference);
        }
        return result;
    }

    private static double[] multiply(double[] left, double[] right) {
        double[] product = new double[left.length + right.length - 1];
        for (int i = 0; i < left.length; i++) {
            if (left[i] == 0.0) {
                continue;
            }
            for (int j = 0; j < right.length; j++) {
                product[i + j] += left[i] * right[j];
            }
        }
        return product;
    }
}
