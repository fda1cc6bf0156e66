package com.demandplanner.forecast;

public record SeasonalModelConfig(
    String name,
    int ar,
    int differences,
    int ma,
    int seasonalAr,
    int seasonalDifferences,
    int period,
    int maxIterations,
    double alpha
) {

    // (1,1,1)(1,1,0,52)
    public static final SeasonalModelConfig PRODUCT =
        new SeasonalModelConfig("product", 1, 1, 1, 1, 1, 52, 200, 0.2);

    // (1,1,1)
    public static final SeasonalModelConfig FABRIC =
        new SeasonalModelConfig("fabric", 1, 1, 1, 0, 0, 52, 200, 0.2);

    public boolean isSeasonal() {
        return seasonalAr > 0 || seasonalDifferences > 0;
    }

    public SeasonalModelConfig withoutSeasonal() {
        return new SeasonalModelConfig(name + "-nonseasonal", ar, differences, ma, 0, 0, period, maxIterations, alpha);
    }

    public int arDegree() {
        return ar + differences + (seasonalAr + seasonalDifferences) * period;
    }

    public int parameterCount() {
        return ar + ma + seasonalAr;
    }
}
