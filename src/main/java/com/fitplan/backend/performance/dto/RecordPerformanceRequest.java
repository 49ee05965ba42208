package com.fitplan.backend.performance.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public record RecordPerformanceRequest(
        @NotNull Long workoutId,
        LocalDate date,                                // null → 用戶時區的今天
        List<@Valid @NotNull PerformanceEntryRequest> entries
) {}
