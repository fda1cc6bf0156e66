package com.demandplanner.dto;

import com.demandplanner.forecast.RecursionStrategy;
import com.demandplanner.requirements.ExplosionMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RunForecastRequest {

    ExplosionMode mode;

    @Min(value = 1, message = "horizonWeeks must be between 1 and 26")
    @Max(value = 26, message = "horizonWeeks must be between 1 and 26")
    Integer horizonWeeks;

    RecursionStrategy recursionStrategy;
}
