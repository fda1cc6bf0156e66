package com.demandplanner.config;

import com.demandplanner.forecast.RecursionStrategy;
import com.demandplanner.requirements.ExplosionMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "planning")
public record PlanningConfig(
    @DefaultValue("8") @Min(1) @Max(52) int horizonWeeks,
    @DefaultValue("5") @DecimalMin("0.0") double defaultWastagePercent,
    @DefaultValue("30") @Min(1) int minHistoryWeeksForModel,
    @DefaultValue("4") @Min(0) int minActiveWeeks,
    @DefaultValue("8") @Min(1) int trailingAverageWeeks,
    @DefaultValue("10") @Min(0) int modelProductLimit,
    @DefaultValue("365") @Min(1) int rankingLookbackDays,
    @DefaultValue("6") @Min(1) int mixLookbackMonths,
    @DefaultValue("8") @Min(1) int driverLookbackWeeks,
    @DefaultValue("ALLOCATION") @NotNull ExplosionMode mode,
    @DefaultValue("CARRY_FORWARD") @NotNull RecursionStrategy recursionStrategy
) {

    public static PlanningConfig defaults() {
        return new PlanningConfig(8, 5.0, 30, 4, 8, 10, 365, 6, 8,
            ExplosionMode.ALLOCATION, RecursionStrategy.CARRY_FORWARD);
    }

    public PlanningConfig withHorizonWeeks(int weeks) {
        return new PlanningConfig(weeks, defaultWastagePercent, minHistoryWeeksForModel, minActiveWeeks,
            trailingAverageWeeks, modelProductLimit, rankingLookbackDays, mixLookbackMonths,
            driverLookbackWeeks, mode, recursionStrategy);
    }

    public PlanningConfig withMode(ExplosionMode explosionMode) {
        return new PlanningConfig(horizonWeeks, defaultWastagePercent, minHistoryWeeksForModel, minActiveWeeks,
            trailingAverageWeeks, modelProductLimit, rankingLookbackDays, mixLookbackMonths,
            driverLookbackWeeks, explosionMode, recursionStrategy);
    }

    public PlanningConfig withRecursionStrategy(RecursionStrategy strategy) {
        return new PlanningConfig(horizonWeeks, defaultWastagePercent, minHistoryWeeksForModel, minActiveWeeks,
            trailingAverageWeeks, modelProductLimit, rankingLookbackDays, mixLookbackMonths,
            driverLookbackWeeks, mode, strategy);
    }
}
