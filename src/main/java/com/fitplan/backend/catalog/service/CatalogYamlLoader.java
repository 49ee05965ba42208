package com.fitplan.backend.catalog.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fitplan.backend.catalog.entity.ExerciseEntity;
import com.fitplan.backend.catalog.entity.PairedSet;
import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.sheet.layout.PairingResolver;
import com.fitplan.backend.sheet.layout.RepRange;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 解析 exercises.yaml / workouts.yaml → entity（不寫 DB）。
 */
@Component
public class CatalogYamlLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExerciseYaml(
            Long id,
            String name,
            Integer sets,
            List<Integer> reps,   // [min, max]；max=-99 → 力竭
            String comment,
            Integer rest
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkoutYaml(
            Long id,
            String name,
            List<Long> exercises,
            @JsonProperty("paired_sets") List<List<Long>> pairedSets,
            String comment
    ) {}

    public List<ExerciseEntity> readExercises(Path path) {
        List<ExerciseYaml> rows = read(path, new TypeReference<List<ExerciseYaml>>() {});
        List<ExerciseEntity> out = new ArrayList<>(rows.size());
        for (ExerciseYaml y : rows) {
            if (y == null || y.id() == null) continue;
            ExerciseEntity e = new ExerciseEntity();
            e.setId(y.id());
            e.setName(y.name() == null || y.name().isBlank() ? "#" + y.id() : y.name().strip());
            e.setSets(y.sets());
            RepRange reps = RepRange.fromList(y.reps());
            if (reps != null) {
                e.setRepsMin(reps.min());
                e.setRepsMax(reps.max());
            }
            e.setComment(y.comment() == null ? null : y.comment().strip());
            e.setRestSeconds(y.rest());
            out.add(e);
        }
        return out;
    }

    public List<WorkoutEntity> readWorkouts(Path path) {
        List<WorkoutYaml> rows = read(path, new TypeReference<List<WorkoutYaml>>() {});
        List<WorkoutEntity> out = new ArrayList<>(rows.size());
        for (WorkoutYaml y : rows) {
            if (y == null || y.id() == null) continue;
            WorkoutEntity w = new WorkoutEntity();
            w.setId(y.id());
            w.setName(y.name() == null || y.name().isBlank() ? "Workout " + y.id() : y.name().strip());
            w.setComment(y.comment());
            if (y.exercises() != null) {
                y.exercises().stream().filter(Objects::nonNull).forEach(w.getExerciseIds()::add);
            }
            if (y.pairedSets() != null) {
                for (List<Long> pair : y.pairedSets()) {
                    // 取前兩個非 null 值；只剩一個的照存（PairingResolver 會略過），全空的丟掉
                    List<Long> usable = PairingResolver.usableValues(pair);
                    if (usable.isEmpty()) continue;
                    w.getPairedSets().add(new PairedSet(usable.get(0), usable.size() > 1 ? usable.get(1) : null));
                }
            }
            out.add(w);
        }
        return out;
    }

    private static <T> List<T> read(Path path, TypeReference<List<T>> type) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalStateException("CATALOG_LOAD_FAILED: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode root = YAML.readTree(in);
            // 空檔案 / 只有 "---" → 沒資料
            if (root == null || root.isMissingNode() || root.isNull()) return List.of();
            List<T> rows = YAML.convertValue(root, type);
            return rows == null ? List.of() : rows;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("CATALOG_LOAD_FAILED: " + path, e);
        }
    }
}
