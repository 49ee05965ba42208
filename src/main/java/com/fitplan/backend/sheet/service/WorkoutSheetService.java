package com.fitplan.backend.sheet.service;

import com.fitplan.backend.catalog.entity.WorkoutEntity;
import com.fitplan.backend.catalog.service.CatalogMapper;
import com.fitplan.backend.catalog.service.CatalogService;
import com.fitplan.backend.common.FileNames;
import com.fitplan.backend.sheet.config.SheetProperties;
import com.fitplan.backend.sheet.layout.ExerciseLookup;
import com.fitplan.backend.sheet.layout.SheetLayout;
import com.fitplan.backend.sheet.layout.SheetLayoutEngine;
import com.fitplan.backend.sheet.render.PdfSheetRenderer;
import com.fitplan.backend.sheet.render.SheetRenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 課表 → 排版 → PDF。
 * DB 讀取都在呼叫端執行緒做完，平行的部分只跑純運算 + 寫檔。
 */
@Slf4j
@Service
public class WorkoutSheetService {

    private final CatalogService catalog;
    private final SheetLayoutEngine engine;
    private final PdfSheetRenderer renderer;
    private final SheetProperties props;
    private final TaskExecutor executor;

    public WorkoutSheetService(
            CatalogService catalog,
            SheetLayoutEngine engine,
            PdfSheetRenderer renderer,
            SheetProperties props,
            @Qualifier("sheetRenderExecutor") TaskExecutor executor
    ) {
        this.catalog = catalog;
        this.engine = engine;
        this.renderer = renderer;
        this.props = props;
        this.executor = executor;
    }

    public SheetLayout layout(Long workoutId) {
        WorkoutEntity w = catalog.requireWorkout(workoutId);
        return layout(w, catalog.lookupFor(w.getExerciseIds()));
    }

    public RenderedSheet renderPdf(Long workoutId) {
        WorkoutEntity w = catalog.requireWorkout(workoutId);
        return render(w, catalog.lookupFor(w.getExerciseIds()));
    }

    /**
     * 全部（或指定一個）workout 輸出到 output-dir。
     * 回傳寫出的檔案，順序同 workout id。
     */
    public List<Path> renderAll(Long workoutIdOrNull) {
        List<WorkoutEntity> targets = (workoutIdOrNull == null)
                ? catalog.allWorkouts()
                : List.of(catalog.requireWorkout(workoutIdOrNull));
        if (targets.isEmpty()) {
            log.info("[Sheet] no workouts to render");
            return List.of();
        }

        Set<Long> allIds = new LinkedHashSet<>();
        targets.forEach(w -> allIds.addAll(w.getExerciseIds()));
        ExerciseLookup lookup = catalog.lookupFor(allIds);
        Path dir = Path.of(props.getOutputDir());

        List<CompletableFuture<Path>> jobs = new ArrayList<>(targets.size());
        for (WorkoutEntity w : targets) {
            jobs.add(CompletableFuture.supplyAsync(() -> write(dir, render(w, lookup)), executor));
        }

        List<Path> written = new ArrayList<>(jobs.size());
        for (CompletableFuture<Path> job : jobs) {
            try {
                written.add(job.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException re) throw re;
                throw e;
            }
        }
        log.info("[Sheet] wrote {} sheets to {}", written.size(), dir.toAbsolutePath());
        return written;
    }

    private SheetLayout layout(WorkoutEntity w, ExerciseLookup lookup) {
        return engine.layout(w.displayName(), w.getExerciseIds(), CatalogMapper.pairedSetsOf(w), lookup);
    }

    private RenderedSheet render(WorkoutEntity w, ExerciseLookup lookup) {
        SheetLayout layout = layout(w, lookup);
        byte[] pdf = renderer.render(layout, engine.geometry());
        return new RenderedSheet(fileName(w.getId(), w.displayName()), pdf, layout.pageCount());
    }

    private static Path write(Path dir, RenderedSheet sheet) {
        try {
            Files.createDirectories(dir);
            Path out = dir.resolve(sheet.fileName());
            Files.write(out, sheet.content());
            log.info("[Sheet] written {} ({} pages)", out, sheet.pageCount());
            return out;
        } catch (IOException e) {
            throw new SheetRenderException("SHEET_WRITE_FAILED", e);
        }
    }

    /** workout_3_Push_Day_A.pdf */
    public static String fileName(Long workoutId, String name) {
        return "workout_" + workoutId + "_" + FileNames.sanitize(name) + ".pdf";
    }
}
