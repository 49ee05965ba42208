package com.fitplan.backend.catalog.service;

import com.fitplan.backend.catalog.config.CatalogProperties;
import com.fitplan.backend.catalog.dto.CatalogReloadResponse;
import com.fitplan.backend.catalog.dto.CatalogStats;
import com.fitplan.backend.catalog.dto.ExerciseDto;
import com.fitplan.backend.catalog.dto.WorkoutDto;
import com.fitplan.backend.catalog.entity.ExerciseEntity;
import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.catalog.repo.ExerciseRepository;
import com.fitplan.backend.catalog.repo.WorkoutRepository;
import com.fitplan.backend.sheet.layout.ExerciseLookup;
import com.fitplan.backend.sheet.layout.ExerciseSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@Service
public class CatalogService {

    private final ExerciseRepository exercises;
    private final WorkoutRepository workouts;
    private final CatalogYamlLoader loader;
    private final CatalogProperties props;

    public CatalogService(
            ExerciseRepository exercises,
            WorkoutRepository workouts,
            CatalogYamlLoader loader,
            CatalogProperties props
    ) {
        this.exercises = exercises;
        this.workouts = workouts;
        this.loader = loader;
        this.props = props;
    }

    @Transactional
    public CatalogReloadResponse reload() {
        return reload(Path.of(props.getExercisesPath()), Path.of(props.getWorkoutsPath()));
    }

    /**
     * 整批覆寫：先解析兩個檔（任一失敗就不動 DB），再清表重寫。
     */
    @Transactional
    public CatalogReloadResponse reload(Path exercisesYaml, Path workoutsYaml) {
        List<ExerciseEntity> ex = loader.readExercises(exercisesYaml);
        List<WorkoutEntity> wk = loader.readWorkouts(workoutsYaml);

        workouts.deleteAll();
        exercises.deleteAll();
        workouts.flush();
        exercises.flush();

        exercises.saveAll(ex);
        workouts.saveAll(wk);

        long dangling = wk.stream()
                .flatMap(w -> w.getExerciseIds().stream())
                .filter(id -> ex.stream().noneMatch(e -> e.getId().equals(id)))
                .count();
        if (dangling > 0) {
            log.warn("[Catalog] {} workout exercise references point to unknown exercises", dangling);
        }
        return new CatalogReloadResponse(ex.size(), wk.size());
    }

    @Transactional(readOnly = true)
    public List<ExerciseDto> listExercises() {
        return exercises.findAllByOrderByIdAsc().stream().map(CatalogMapper::toDto).toList();
    }

    @Transactional(readOnly = true)
    public ExerciseDto getExercise(Long id) {
        return exercises.findById(id)
                .map(CatalogMapper::toDto)
                .orElseThrow(() -> new NoSuchElementException("EXERCISE_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public List<WorkoutDto> listWorkouts() {
        return workouts.findAllByOrderByIdAsc().stream().map(CatalogMapper::toDto).toList();
    }

    @Transactional(readOnly = true)
    public WorkoutDto getWorkout(Long id) {
        return CatalogMapper.toDto(requireWorkout(id));
    }

    @Transactional(readOnly = true)
    public WorkoutEntity requireWorkout(Long id) {
        return workouts.findById(id)
                .orElseThrow(() -> new NoSuchElementException("WORKOUT_NOT_FOUND"));
    }

    /** 目前 DB 裡的目錄筆數 */
    @Transactional(readOnly = true)
    public CatalogStats stats() {
        return new CatalogStats(exercises.count(), workouts.count());
    }

    @Transactional(readOnly = true)
    public List<WorkoutEntity> allWorkouts() {
        return workouts.findAllByOrderByIdAsc();
    }

    /** 只載入需要的動作；查不到的 id 交給 layout 印 placeholder */
    @Transactional(readOnly = true)
    public ExerciseLookup lookupFor(Collection<Long> exerciseIds) {
        Map<Long, ExerciseSpec> byId = new LinkedHashMap<>();
        if (exerciseIds != null && !exerciseIds.isEmpty()) {
            for (ExerciseEntity e : exercises.findAllByIdInOrderByIdAsc(exerciseIds)) {
                byId.put(e.getId(), CatalogMapper.toSpec(e));
            }
        }
        return ExerciseLookup.of(Map.copyOf(byId));
    }
}
