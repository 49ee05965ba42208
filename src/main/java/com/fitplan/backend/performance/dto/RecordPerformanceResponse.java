package com.fitplan.backend.performance.dto;

import java.time.LocalDate;
import java.util.List;

public record RecordPerformanceResponse(
        Long workoutId,
        LocalDate date,
        int written,
        List<PerformanceEntryDto> entries
) {}
