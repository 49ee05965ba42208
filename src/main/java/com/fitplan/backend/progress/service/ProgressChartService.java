package com.fitplan.backend.progress.service;

import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.catalog.service.CatalogService;
import com.fitplan.backend.common.FileNames;
import com.fitplan.backend.performance.repo.PerformanceEntryRepository;
import com.fitplan.backend.progress.chart.ChartRenderException;
import com.fitplan.backend.progress.chart.ProgressChartRenderer;
import com.fitplan.backend.progress.config.ChartProperties;
import com.fitplan.backend.progress.dto.ExerciseProgressPanel;
import com.fitplan.backend.progress.dto.RenderedChart;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 進度圖 PNG：
 * - workout_<id>_<name>.png：一個 workout 一張，每個動作一格
 * - exercise_<id>_<name>.png：單一動作跨 workout
 */
@Slf4j
@Service
public class ProgressChartService {

    private final ProgressService progress;
    private final CatalogService catalog;
    private final PerformanceEntryRepository perf;
    private final ProgressChartRenderer renderer;
    private final ChartProperties props;

    public ProgressChartService(
            ProgressService progress,
            CatalogService catalog,
            PerformanceEntryRepository perf,
            ProgressChartRenderer renderer,
            ChartProperties props
    ) {
        this.progress = progress;
        this.catalog = catalog;
        this.perf = perf;
        this.renderer = renderer;
        this.props = props;
    }

    public RenderedChart workoutChart(Long workoutId) {
        WorkoutEntity w = catalog.requireWorkout(workoutId);
        WorkoutProgressResponse wp = progress.workoutProgress(workoutId);
        return new RenderedChart(workoutFileName(w.getId(), w.displayName()), renderer.workoutPng(wp));
    }

    public RenderedChart exerciseChart(Long exerciseId) {
        ExerciseProgressPanel panel = progress.exercisePanel(exerciseId);
        return new RenderedChart(exerciseFileName(exerciseId, panel.title()), renderer.exercisePng(panel));
    }

    /**
     * 全部輸出到 app.chart.output-dir。
     * 完全沒紀錄的 workout 不畫；動作圖只畫有紀錄的動作。
     */
    public List<Path> renderAll() {
        Path dir = Path.of(props.getOutputDir());
        List<Path> written = new ArrayList<>();

        for (WorkoutEntity w : catalog.allWorkouts()) {
            WorkoutProgressResponse wp = progress.workoutProgress(w.getId());
            if (wp.panels().stream().noneMatch(ExerciseProgressPanel::hasData)) {
                log.debug("[Chart] workout {} has no performance data, skipped", w.getId());
                continue;
            }
            written.add(write(dir, new RenderedChart(
                    workoutFileName(w.getId(), w.displayName()), renderer.workoutPng(wp))));
        }

        for (Long exerciseId : perf.findDistinctExerciseIds()) {
            written.add(write(dir, exerciseChart(exerciseId)));
        }

        log.info("[Chart] wrote {} charts to {}", written.size(), dir.toAbsolutePath());
        return written;
    }

    private static Path write(Path dir, RenderedChart chart) {
        try {
            Files.createDirectories(dir);
            Path out = dir.resolve(chart.fileName());
            Files.write(out, chart.content());
            return out;
        } catch (IOException e) {
            throw new ChartRenderException("CHART_WRITE_FAILED", e);
        }
    }

    /** workout_3_Push_Day_A.png */
    public static String workoutFileName(Long workoutId, String name) {
        return "workout_" + workoutId + "_" + FileNames.sanitize(name) + ".png";
    }

    public static String exerciseFileName(Long exerciseId, String title) {
        return "exercise_" + exerciseId + "_" + FileNames.sanitize(title) + ".png";
    }
}
