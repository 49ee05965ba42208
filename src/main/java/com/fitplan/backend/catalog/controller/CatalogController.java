package com.fitplan.backend.catalog.controller;

import com.fitplan.backend.catalog.dto.CatalogReloadResponse;
import com.fitplan.backend.catalog.dto.ExerciseDto;
import com.fitplan.backend.catalog.dto.WorkoutDto;
import com.fitplan.backend.catalog.service.CatalogService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class CatalogController {

    private final CatalogService svc;

    public CatalogController(CatalogService svc) {
        this.svc = svc;
    }

    @GetMapping("/exercises")
    public List<ExerciseDto> exercises() {
        return svc.listExercises();
    }

    @GetMapping("/exercises/{id}")
    public ExerciseDto exercise(@PathVariable Long id) {
        return svc.getExercise(id);
    }

    @GetMapping("/workouts")
    public List<WorkoutDto> workouts() {
        return svc.listWorkouts();
    }

    @GetMapping("/workouts/{id}")
    public WorkoutDto workout(@PathVariable Long id) {
        return svc.getWorkout(id);
    }

    /** 重新讀 YAML，整批覆寫 exercises / workouts */
    @PostMapping("/catalog/reload")
    public CatalogReloadResponse reload() {
        return svc.reload();
    }
}
