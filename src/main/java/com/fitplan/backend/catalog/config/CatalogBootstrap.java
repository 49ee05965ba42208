package com.fitplan.backend.catalog.config;

import com.fitplan.backend.catalog.dto.CatalogReloadResponse;
import com.fitplan.backend.catalog.service.CatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 啟動時把 exercises.yaml / workouts.yaml 匯入 DB。
 * 失敗不讓啟動失敗，只印 warn。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogBootstrap implements ApplicationRunner {

    private final CatalogProperties props;
    private final CatalogService catalog;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isLoadOnStartup()) {
            log.info("[Catalog] load-on-startup disabled");
            return;
        }
        Path exercises = Path.of(props.getExercisesPath());
        Path workouts = Path.of(props.getWorkoutsPath());
        if (!Files.exists(exercises) || !Files.exists(workouts)) {
            log.info("[Catalog] skip startup load, files not found: {} / {}", exercises, workouts);
            return;
        }
        try {
            CatalogReloadResponse r = catalog.reload();
            log.info("[Catalog] loaded {} exercises, {} workouts", r.exercises(), r.workouts());
        } catch (Exception e) {
            log.warn("[Catalog] startup load failed: {}", e.toString());
        }
    }
}
