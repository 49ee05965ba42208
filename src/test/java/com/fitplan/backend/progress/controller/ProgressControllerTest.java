package com.fitplan.backend.progress.controller;

import com.fitplan.backend.common.web.ApiExceptionHandler;
import com.fitplan.backend.common.web.RequestIdFilter;
import com.fitplan.backend.progress.chart.ChartRenderException;
import com.fitplan.backend.progress.dto.ExerciseProgressPanel;
import com.fitplan.backend.progress.dto.ProgressPoint;
import com.fitplan.backend.progress.dto.RenderedChart;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import com.fitplan.backend.progress.service.ProgressChartService;
import com.fitplan.backend.progress.service.ProgressService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = ProgressController.class)
@Import({ApiExceptionHandler.class, RequestIdFilter.class})
class ProgressControllerTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};

    @Autowired MockMvc mvc;

    @MockitoBean ProgressService svc;
    @MockitoBean ProgressChartService charts;

    @Test
    void exercise_series_as_json() throws Exception {
        Mockito.when(svc.exerciseSeries(1L)).thenReturn(List.of(
                new ProgressPoint(LocalDate.of(2026, 3, 1), 8.0, null)));

        mvc.perform(get("/api/v1/progress/exercises/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].date").value("2026-03-01"))
                .andExpect(jsonPath("$[0].avgReps").value(8.0))
                .andExpect(jsonPath("$[0].avgWeight").doesNotExist());
    }

    @Test
    void workout_progress_as_json() throws Exception {
        Mockito.when(svc.workoutProgress(1L)).thenReturn(new WorkoutProgressResponse(1L, "Push (id=1)", List.of(
                new ExerciseProgressPanel(2L, "exercise_2", "", List.of()))));

        mvc.perform(get("/api/v1/progress/workouts/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Push (id=1)"))
                .andExpect(jsonPath("$.panels[0].title").value("exercise_2"))
                .andExpect(jsonPath("$.panels[0].points").isEmpty());
    }

    @Test
    void exercise_png() throws Exception {
        Mockito.when(charts.exerciseChart(1L)).thenReturn(new RenderedChart("exercise_1_Bench.png", PNG));

        mvc.perform(get("/api/v1/progress/exercises/1.png"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(header().string("Content-Disposition", containsString("exercise_1_Bench.png")))
                .andExpect(content().bytes(PNG));
    }

    @Test
    void workout_png() throws Exception {
        Mockito.when(charts.workoutChart(3L)).thenReturn(new RenderedChart("workout_3_Push.png", PNG));

        mvc.perform(get("/api/v1/progress/workouts/3.png"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(PNG));
    }

    @Test
    void workout_png_unknown_should_404_with_code() throws Exception {
        Mockito.when(charts.workoutChart(99L)).thenThrow(new NoSuchElementException("WORKOUT_NOT_FOUND"));

        mvc.perform(get("/api/v1/progress/workouts/99.png"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("WORKOUT_NOT_FOUND"))
                .andExpect(jsonPath("$.requestId").exists());
    }

    @Test
    void chart_write_failure_should_500_with_code() throws Exception {
        Mockito.when(charts.renderAll()).thenThrow(
                new ChartRenderException("CHART_WRITE_FAILED", new IOException("disk full")));

        mvc.perform(post("/api/v1/progress/charts/render"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("CHART_WRITE_FAILED"));
    }

    @Test
    void render_all_lists_written_files() throws Exception {
        Mockito.when(charts.renderAll()).thenReturn(List.of(Path.of("out", "workout_1_Push.png")));

        mvc.perform(post("/api/v1/progress/charts/render"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.written[0]").value(containsString("workout_1_Push.png")));
    }
}
