package com.fitplan.backend.catalog.dto;

import java.util.List;

public record WorkoutDto(
        Long id,
        String name,
        String comment,
        List<Long> exerciseIds,
        List<List<Long>> pairedSets
) {}
