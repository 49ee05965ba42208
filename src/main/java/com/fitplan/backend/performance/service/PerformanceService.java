package com.fitplan.backend.performance.service;

import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.catalog.service.CatalogService;
import com.fitplan.backend.performance.dto.PerformanceEntryDto;
import com.fitplan.backend.performance.dto.PerformanceEntryRequest;
import com.fitplan.backend.performance.dto.RecordPerformanceRequest;
import com.fitplan.backend.performance.dto.RecordPerformanceResponse;
import com.fitplan.backend.performance.entity.PerformanceEntryEntity;
import com.fitplan.backend.performance.repo.PerformanceEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class PerformanceService {

    private final PerformanceEntryRepository repo;
    private final CatalogService catalog;

    public PerformanceService(PerformanceEntryRepository repo, CatalogService catalog) {
        this.repo = repo;
        this.catalog = catalog;
    }

    /** 由 header 解析 IANA 時區，失敗回 UTC（不拒絕請求） */
    public ZoneId parseZoneOrUtc(String header) {
        try { return (header == null || header.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(header.trim()); }
        catch (Exception e) { return ZoneId.of("UTC"); }
    }

    /**
     * 依 workout 的動作順序，每個動作寫一筆；
     * request 沒提到的動作寫空 reps（= 提早結束）。
     */
    @Transactional
    public RecordPerformanceResponse record(RecordPerformanceRequest req, ZoneId zone) {
        WorkoutEntity workout = catalog.requireWorkout(req.workoutId());
        LocalDate date = (req.date() != null) ? req.date() : LocalDate.now(zone);

        Set<Long> inWorkout = new LinkedHashSet<>(workout.getExerciseIds());
        Map<Long, PerformanceEntryRequest> byExercise = new HashMap<>();
        if (req.entries() != null) {
            for (PerformanceEntryRequest e : req.entries()) {
                if (!inWorkout.contains(e.exerciseId())) {
                    throw new IllegalArgumentException("EXERCISE_NOT_IN_WORKOUT");
                }
                byExercise.put(e.exerciseId(), e);
            }
        }

        List<PerformanceEntryEntity> rows = new ArrayList<>(inWorkout.size());
        for (Long exerciseId : inWorkout) {
            PerformanceEntryRequest e = byExercise.get(exerciseId);
            List<Integer> reps = (e == null) ? List.of() : repsOf(e);
            List<Double> weights = (e == null) ? List.of() : weightsOf(e);

            PerformanceEntryEntity row = new PerformanceEntryEntity();
            row.setWorkoutId(workout.getId());
            row.setExerciseId(exerciseId);
            row.setSessionDate(date);
            row.setReps(new ArrayList<>(reps));
            row.setWeights(normalizeWeights(reps, weights));
            rows.add(row);
        }

        List<PerformanceEntryEntity> saved = repo.saveAll(rows);
        log.info("[Performance] workout={} date={} wrote {} rows", workout.getId(), date, saved.size());
        return new RecordPerformanceResponse(
                workout.getId(),
                date,
                saved.size(),
                saved.stream().map(PerformanceService::toDto).toList()
        );
    }

    @Transactional(readOnly = true)
    public List<PerformanceEntryDto> list(Long workoutId, Long exerciseId) {
        return repo.search(workoutId, exerciseId).stream().map(PerformanceService::toDto).toList();
    }

    /**
     * weights 對齊 reps：
     * - reps 空 → weights 也清空
     * - 只給一個重量、多組 → 每組同重量
     * - 多的截掉，少的補 0
     */
    static List<Double> normalizeWeights(List<Integer> reps, List<Double> weights) {
        if (reps == null || reps.isEmpty()) return new ArrayList<>();
        List<Double> w = (weights == null) ? List.of() : weights;

        if (w.size() == 1 && reps.size() > 1) {
            return new ArrayList<>(Collections.nCopies(reps.size(), w.get(0)));
        }
        List<Double> out = new ArrayList<>(reps.size());
        for (int i = 0; i < reps.size(); i++) {
            out.add(i < w.size() ? w.get(i) : 0.0);
        }
        return out;
    }

    private static List<Integer> repsOf(PerformanceEntryRequest e) {
        List<Integer> reps = (e.reps() != null) ? e.reps() : PerformanceInputParser.parseInts(e.repsText());
        requireNonNegative(reps);
        return reps;
    }

    private static List<Double> weightsOf(PerformanceEntryRequest e) {
        List<Double> weights = (e.weights() != null) ? e.weights() : PerformanceInputParser.parseDoubles(e.weightsText());
        requireNonNegative(weights);
        return weights;
    }

    private static void requireNonNegative(List<? extends Number> values) {
        for (Number n : values) {
            if (n == null || n.doubleValue() < 0) throw new IllegalArgumentException("NEGATIVE_VALUE");
        }
    }

    static PerformanceEntryDto toDto(PerformanceEntryEntity e) {
        return new PerformanceEntryDto(
                e.getId(),
                e.getWorkoutId(),
                e.getExerciseId(),
                e.getSessionDate(),
                List.copyOf(e.getReps()),
                List.copyOf(e.getWeights())
        );
    }
}
