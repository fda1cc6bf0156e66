package com.demandplanner.service;

import com.demandplanner.config.PlanningConfig;
import com.demandplanner.dto.DemandForecastResponse;
import com.demandplanner.dto.ForecastRunResponse;
import com.demandplanner.dto.ForecastRunSummary;
import com.demandplanner.dto.RunForecastRequest;
import com.demandplanner.entity.ForecastRun;
import com.demandplanner.exception.ForecastRunNotFoundException;
import com.demandplanner.exception.ForecastSerializationException;
import com.demandplanner.repository.ForecastRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastRunService {

    private final DemandPlanningService planningService;
    private final ForecastRunRepository repository;
    private final PlanningConfig        defaults;
    private final ObjectMapper          objectMapper;

    @Transactional
    public ForecastRunResponse run(RunForecastRequest request, String requestId) {
        PlanningConfig config = resolve(request);
        DemandForecastResponse result = planningService.run(config);
        JsonNode data = objectMapper.valueToTree(result);

        ForecastRun saved = repository.save(ForecastRun.builder()
            .mode(config.mode())
            .horizonWeeks(config.horizonWeeks())
            .totalForecastUnits(result.getSummary().getTotalForecastUnits())
            .productsForecasted(result.getSummary().getProductsForecasted())
            .shortfallCount(result.getSummary().getShortfallCount())
            .estimatedPurchaseCost(result.getSummary().getEstimatedPurchaseCost())
            .payload(write(data))
            .requestId(requestId)
            .build());
        log.info("Forecast run saved | id={} | mode={} | products={} | shortfalls={} | requestId={}",
            saved.getId(), config.mode(), result.getSummary().getProductsForecasted(),
            result.getSummary().getShortfallCount(), requestId);
        return toResponse(saved, data);
    }

    @Transactional(readOnly = true)
    public List<ForecastRunSummary> history(int limit) {
        return repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit)).stream()
            .map(this::toSummary)
            .toList();
    }

    @Transactional(readOnly = true)
    public ForecastRunResponse get(UUID id) {
        ForecastRun run = repository.findById(id)
            .orElseThrow(() -> new ForecastRunNotFoundException(id));
        return toResponse(run, read(run.getPayload()));
    }

    private PlanningConfig resolve(RunForecastRequest request) {
        PlanningConfig config = defaults;
        if (request == null) {
            return config;
        }
        if (request.getMode() != null) {
            config = config.withMode(request.getMode());
        }
        if (request.getHorizonWeeks() != null) {
            config = config.withHorizonWeeks(request.getHorizonWeeks());
        }
        if (request.getRecursionStrategy() != null) {
            config = config.withRecursionStrategy(request.getRecursionStrategy());
        }
        return config;
    }

    private String write(JsonNode data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException ex) {
            throw new ForecastSerializationException(ex);
        }
    }

    private JsonNode read(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new ForecastSerializationException(ex);
        }
    }

    private ForecastRunResponse toResponse(ForecastRun run, JsonNode data) {
        return ForecastRunResponse.builder()
            .id(run.getId())
            .createdAt(run.getCreatedAt() != null ? run.getCreatedAt() : Instant.now())
            .requestId(run.getRequestId())
            .data(data)
            .build();
    }

    private ForecastRunSummary toSummary(ForecastRun run) {
        return ForecastRunSummary.builder()
            .id(run.getId())
            .createdAt(run.getCreatedAt())
            .mode(run.getMode())
            .horizonWeeks(run.getHorizonWeeks())
            .totalForecastUnits(run.getTotalForecastUnits())
            .productsForecasted(run.getProductsForecasted())
            .shortfallCount(run.getShortfallCount())
            .estimatedPurchaseCost(run.getEstimatedPurchaseCost())
            .requestId(run.getRequestId())
            .build();
    }
}
