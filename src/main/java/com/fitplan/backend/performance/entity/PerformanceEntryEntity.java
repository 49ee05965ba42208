package com.fitplan.backend.performance.entity;

import com.fitplan.backend.common.DoubleListConverter;
import com.fitplan.backend.common.IntegerListConverter;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次訓練中某個動作的實際表現（每組 reps / kg）。
 * reps 為空 = 這個動作提早結束 / 沒做。
 */
@Data
@Entity
@Table(name = "performance",
        indexes = {
                @Index(name = "idx_perf_exercise_date", columnList = "exercise_id,session_date"),
                @Index(name = "idx_perf_workout", columnList = "workout_id")
        })
public class PerformanceEntryEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workout_id", nullable = false)
    private Long workoutId;

    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Convert(converter = IntegerListConverter.class)
    @Column(name = "reps", nullable = false, length = 500)
    private List<Integer> reps = new ArrayList<>();

    @Convert(converter = DoubleListConverter.class)
    @Column(name = "weights", nullable = false, length = 1000)
    private List<Double> weights = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
