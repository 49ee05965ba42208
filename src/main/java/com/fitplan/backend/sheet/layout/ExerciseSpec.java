package com.fitplan.backend.sheet.layout;

/**
 * 一次 render 期間不變的動作資料。
 * sets 缺值 → 3；rest 缺值 → 不顯示。
 */
public record ExerciseSpec(
        long id,
        String name,
        Integer sets,
        RepRange reps,       // nullable
        String comment,      // nullable
        Integer restSeconds  // nullable
) {
    public static final int DEFAULT_SETS = 3;

    public ExerciseSpec {
        if (comment != null) {
            comment = comment.strip();
            if (comment.isEmpty()) comment = null;
        }
    }

    public int effectiveSets() {
        return (sets == null || sets <= 0) ? DEFAULT_SETS : sets;
    }

    public String displayName() {
        return (name == null || name.isBlank()) ? "#" + id : name;
    }
}
