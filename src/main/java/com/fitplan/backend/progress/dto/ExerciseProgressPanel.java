package com.fitplan.backend.progress.dto;

import java.util.List;

public record ExerciseProgressPanel(
        Long exerciseId,
        String title,    // 動作名稱；目錄沒有 → "exercise_<id>"
        String meta,     // "sets=3, reps=8-12, rest=90s"
        List<ProgressPoint> points
) {
    public boolean hasData() {
        return points != null && !points.isEmpty();
    }
}
