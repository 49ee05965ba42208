package com.fitplan.backend.progress.controller;

import com.fitplan.backend.progress.dto.ProgressPoint;
import com.fitplan.backend.progress.dto.RenderedChart;
import com.fitplan.backend.progress.dto.WorkoutProgressResponse;
import com.fitplan.backend.progress.service.ProgressChartService;
import com.fitplan.backend.progress.service.ProgressService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/progress")
public class ProgressController {

    private final ProgressService svc;
    private final ProgressChartService charts;

    public ProgressController(ProgressService svc, ProgressChartService charts) {
        this.svc = svc;
        this.charts = charts;
    }

    // 只收數字 id，"3.png" 交給下面的 PNG endpoint
    @GetMapping("/exercises/{id:\\d+}")
    public List<ProgressPoint> exercise(@PathVariable Long id) {
        return svc.exerciseSeries(id);
    }

    /** 一個 workout 每個動作一個 panel；沒資料的 panel points 為空 */
    @GetMapping("/workouts/{id:\\d+}")
    public WorkoutProgressResponse workout(@PathVariable Long id) {
        return svc.workoutProgress(id);
    }

    @GetMapping("/exercises/{id}.png")
    public ResponseEntity<byte[]> exercisePng(@PathVariable Long id) {
        return png(charts.exerciseChart(id));
    }

    @GetMapping("/workouts/{id}.png")
    public ResponseEntity<byte[]> workoutPng(@PathVariable Long id) {
        return png(charts.workoutChart(id));
    }

    /** 寫檔到 app.chart.output-dir */
    @PostMapping("/charts/render")
    public Map<String, List<String>> renderAll() {
        List<String> written = charts.renderAll().stream().map(Path::toString).toList();
        return Map.of("written", written);
    }

    private static ResponseEntity<byte[]> png(RenderedChart chart) {
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.inline().filename(chart.fileName()).build().toString())
                .body(chart.content());
    }
}
