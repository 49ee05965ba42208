package com.fitplan.backend.progress.dto;

import java.util.List;

public record WorkoutProgressResponse(Long workoutId, String title, List<ExerciseProgressPanel> panels) {}
