package com.fitplan.backend.catalog.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Entity
@Table(name = "workouts")
public class WorkoutEntity {
    @Id
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "comment", length = 1000)
    private String comment;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workout_exercises", joinColumns = @JoinColumn(name = "workout_id"))
    @OrderColumn(name = "position")
    @Column(name = "exercise_id", nullable = false)
    private List<Long> exerciseIds = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workout_paired_sets", joinColumns = @JoinColumn(name = "workout_id"))
    @OrderColumn(name = "position")
    private List<PairedSet> pairedSets = new ArrayList<>();

    @Column(name = "loaded_at", nullable = false)
    private Instant loadedAt = Instant.now();

    public String displayName() {
        return (name == null || name.isBlank()) ? "Workout " + id : name;
    }
}
