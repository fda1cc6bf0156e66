package com.demandplanner.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int       status;
    String    code;
    String    message;
    String    path;
    String    requestId;
    String    dataset;
    UUID      runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant   timestamp;
    List<Violation> violations;

    @Value
    @Builder
    public static class Violation {
        String field;
        Object rejectedValue;
        String reason;
    }
}
