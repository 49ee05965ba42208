package com.fitplan.backend.progress.service;

import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.catalog.service.CatalogService;
import com.fitplan.backend.performance.entity.PerformanceEntryEntity;
import com.fitplan.backend.performance.repo.PerformanceEntryRepository;
import com.fitplan.backend.progress.dto.ExerciseProgressPanel;
import com.fitplan.backend.progress.dto.ProgressPoint;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import com.fitplan.backend.sheet.layout.ExerciseLookup;
import com.fitplan.backend.sheet.layout.ExerciseSpec;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 圖表用的時間序列：
 * 1) 每筆 performance 先算 mean(reps) / mean(weights)（空 list → 無值）
 * 2) 同一天的多筆再平均（略過無值）
 */
@Service
public class ProgressService {

    private final PerformanceEntryRepository perf;
    private final CatalogService catalog;

    public ProgressService(PerformanceEntryRepository perf, CatalogService catalog) {
        this.perf = perf;
        this.catalog = catalog;
    }

    @Transactional(readOnly = true)
    public List<ProgressPoint> exerciseSeries(Long exerciseId) {
        return series(perf.findByExerciseIdOrderBySessionDateAscIdAsc(exerciseId));
    }

    @Transactional(readOnly = true)
    public WorkoutProgressResponse workoutProgress(Long workoutId) {
        WorkoutEntity w = catalog.requireWorkout(workoutId);
        List<Long> exerciseIds = new ArrayList<>(new LinkedHashSet<>(w.getExerciseIds()));
        ExerciseLookup lookup = catalog.lookupFor(exerciseIds);

        Map<Long, List<PerformanceEntryEntity>> byExercise = perf.findByWorkoutIdOrderBySessionDateAscIdAsc(workoutId)
                .stream()
                .collect(Collectors.groupingBy(PerformanceEntryEntity::getExerciseId));

        List<ExerciseProgressPanel> panels = new ArrayList<>(exerciseIds.size());
        for (Long id : exerciseIds) {
            panels.add(panelOf(id, lookup.find(id).orElse(null), series(byExercise.getOrDefault(id, List.of()))));
        }
        return new WorkoutProgressResponse(w.getId(), w.displayName() + " (id=" + w.getId() + ")", panels);
    }

    /** 單一動作跨所有 workout 的 panel；目錄沒有這個動作也照畫 */
    @Transactional(readOnly = true)
    public ExerciseProgressPanel exercisePanel(Long exerciseId) {
        ExerciseSpec spec = catalog.lookupFor(List.of(exerciseId)).find(exerciseId).orElse(null);
        return panelOf(exerciseId, spec, exerciseSeries(exerciseId));
    }

    private static ExerciseProgressPanel panelOf(Long id, ExerciseSpec spec, List<ProgressPoint> points) {
        return new ExerciseProgressPanel(
                id,
                spec == null ? "exercise_" + id : spec.displayName(),
                spec == null ? "" : metaOf(spec),
                points
        );
    }

    static List<ProgressPoint> series(List<PerformanceEntryEntity> rows) {
        // TreeMap：依日期排序
        Map<LocalDate, List<PerformanceEntryEntity>> byDate = rows.stream()
                .collect(Collectors.groupingBy(PerformanceEntryEntity::getSessionDate, TreeMap::new, Collectors.toList()));

        List<ProgressPoint> out = new ArrayList<>(byDate.size());
        byDate.forEach((date, list) -> out.add(new ProgressPoint(
                date,
                meanOfMeans(list.stream().map(r -> mean(r.getReps())).toList()),
                meanOfMeans(list.stream().map(r -> mean(r.getWeights())).toList())
        )));
        return out;
    }

    /** "sets=3, reps=8-12, rest=90s"，缺的部分省略 */
    static String metaOf(ExerciseSpec spec) {
        List<String> parts = new ArrayList<>(3);
        if (spec.sets() != null) parts.add("sets=" + spec.sets());
        if (spec.reps() != null) parts.add("reps=" + spec.reps().display());
        if (spec.restSeconds() != null) parts.add("rest=" + spec.restSeconds() + "s");
        return String.join(", ", parts);
    }

    private static Double mean(List<? extends Number> values) {
        if (values == null || values.isEmpty()) return null;
        OptionalDouble avg = values.stream().mapToDouble(Number::doubleValue).average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }

    private static Double meanOfMeans(List<Double> means) {
        OptionalDouble avg = means.stream().filter(m -> m != null).mapToDouble(Double::doubleValue).average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }
}
