package com.fitplan.backend.catalog.dto;

public record ExerciseDto(
        Long id,
        String name,
        int sets,
        String reps,         // "8-12" / "8+"，沒有就 null
        String comment,
        Integer restSeconds
) {}
