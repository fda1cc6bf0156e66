package com.demandplanner.entity;

import com.demandplanner.requirements.ExplosionMode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "forecast_runs",
    indexes = {
        @Index(name = "idx_run_created", columnList = "created_at"),
        @Index(name = "idx_run_mode",    columnList = "mode"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExplosionMode mode;

    @Column(name = "horizon_weeks", nullable = false)
    private int horizonWeeks;

    @Column(name = "total_forecast_units")
    private double totalForecastUnits;

    @Column(name = "products_forecasted")
    private int productsForecasted;

    @Column(name = "shortfall_count")
    private int shortfallCount;

    @Column(name = "estimated_purchase_cost")
    private double estimatedPurchaseCost;

    @Column(nullable = false, columnDefinition = "text")
    private String payload;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
