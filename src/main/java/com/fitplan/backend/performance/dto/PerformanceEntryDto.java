package com.fitplan.backend.performance.dto;

import java.time.LocalDate;
import java.util.List;

public record PerformanceEntryDto(
        Long id,
        Long workoutId,
        Long exerciseId,
        LocalDate date,
        List<Integer> reps,
        List<Double> weights
) {}
