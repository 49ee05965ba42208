package com.fitplan.backend.sheet.layout;

import java.util.Map;
import java.util.Optional;

/**
 * 動作目錄查詢；查不到是正常情況（會印 placeholder）。
 */
@FunctionalInterface
public interface ExerciseLookup {

    Optional<ExerciseSpec> find(long exerciseId);

    static ExerciseLookup of(Map<Long, ExerciseSpec> byId) {
        return id -> Optional.ofNullable(byId.get(id));
    }
}
