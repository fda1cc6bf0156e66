package com.demandplanner.controller;

import com.demandplanner.dto.ForecastRunResponse;
import com.demandplanner.dto.ForecastRunSummary;
import com.demandplanner.dto.RunForecastRequest;
import com.demandplanner.service.ForecastRunService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/forecasts")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastRunService forecastRunService;

    @PostMapping("/run")
    public ResponseEntity<ForecastRunResponse> run(
            @Valid @RequestBody(required = false) RunForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts/run | mode={} | horizonWeeks={} | requestId={}",
                 request != null ? request.getMode() : null,
                 request != null ? request.getHorizonWeeks() : null, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(forecastRunService.run(request, requestId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<ForecastRunSummary>> history(
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(forecastRunService.history(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ForecastRunResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(forecastRunService.get(id));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
