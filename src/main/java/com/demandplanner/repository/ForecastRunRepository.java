package com.demandplanner.repository;

import com.demandplanner.entity.ForecastRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ForecastRunRepository extends JpaRepository<ForecastRun, UUID> {

    List<ForecastRun> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
