package com.demandplanner.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ForecastRunResponse {
    UUID id;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
    JsonNode data;
}
