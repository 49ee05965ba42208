package com.fitplan.backend.performance.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * 單一動作的表現。reps / weights 可以用 list，也可以用逗號字串（"10,8,6"）。
 * 兩種都給時以 list 為準。
 */
public record PerformanceEntryRequest(
        @NotNull Long exerciseId,
        List<@NotNull @PositiveOrZero Integer> reps,
        List<@NotNull @PositiveOrZero Double> weights,
        String repsText,
        String weightsText
) {}
