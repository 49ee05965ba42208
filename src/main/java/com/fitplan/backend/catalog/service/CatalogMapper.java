package com.fitplan.backend.catalog.service;

import com.fitplan.backend.catalog.dto.ExerciseDto;
import com.fitplan.backend.catalog.dto.WorkoutDto;
import com.fitplan.backend.catalog.entity.ExerciseEntity;
import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.sheet.layout.ExerciseSpec;
import com.fitplan.backend.sheet.layout.PairingResolver;
import com.fitplan.backend.sheet.layout.RepRange;

import java.util.List;
import java.util.Objects;

public final class CatalogMapper {

    private CatalogMapper() {}

    public static ExerciseSpec toSpec(ExerciseEntity e) {
        RepRange reps = (e.getRepsMin() == null) ? null : new RepRange(e.getRepsMin(), e.getRepsMax());
        return new ExerciseSpec(e.getId(), e.getName(), e.getSets(), reps, e.getComment(), e.getRestSeconds());
    }

    public static ExerciseDto toDto(ExerciseEntity e) {
        ExerciseSpec spec = toSpec(e);
        return new ExerciseDto(
                e.getId(),
                spec.displayName(),
                spec.effectiveSets(),
                spec.reps() == null ? null : spec.reps().display(),
                spec.comment(),
                spec.restSeconds()
        );
    }

    public static WorkoutDto toDto(WorkoutEntity w) {
        return new WorkoutDto(
                w.getId(),
                w.displayName(),
                w.getComment(),
                List.copyOf(w.getExerciseIds()),
                pairedSetsOf(w)
        );
    }

    /** PairedSet → PairingResolver 吃的原始宣告（可能含 null） */
    public static List<List<Long>> pairedSetsOf(WorkoutEntity w) {
        return w.getPairedSets().stream()
                .filter(Objects::nonNull)
                .map(p -> PairingResolver.declaration(p.getFirst(), p.getSecond()))
                .toList();
    }
}
