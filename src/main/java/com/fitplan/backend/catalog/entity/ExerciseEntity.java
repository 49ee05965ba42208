package com.fitplan.backend.catalog.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "exercises")
public class ExerciseEntity {
    // id 來自 exercises.yaml，不自動產生
    @Id
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "sets")
    private Integer sets;

    @Column(name = "reps_min")
    private Integer repsMin;

    /** -99 = 做到力竭 */
    @Column(name = "reps_max")
    private Integer repsMax;

    @Column(name = "comment", length = 1000)
    private String comment;

    @Column(name = "rest_seconds")
    private Integer restSeconds;

    @Column(name = "loaded_at", nullable = false)
    private Instant loadedAt = Instant.now();
}
