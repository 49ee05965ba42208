package com.fitplan.backend.sheet.controller;

import com.fitplan.backend.sheet.layout.SheetLayout;
import com.fitplan.backend.sheet.service.RenderedSheet;
import com.fitplan.backend.sheet.service.WorkoutSheetService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class WorkoutSheetController {

    private final WorkoutSheetService svc;

    public WorkoutSheetController(WorkoutSheetService svc) {
        this.svc = svc;
    }

    /** 排版結果（debug / 前端自己畫用） */
    @GetMapping("/workouts/{id}/sheet")
    public SheetLayout layout(@PathVariable Long id) {
        return svc.layout(id);
    }

    @GetMapping("/workouts/{id}/sheet.pdf")
    public ResponseEntity<byte[]> pdf(@PathVariable Long id) {
        RenderedSheet sheet = svc.renderPdf(id);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(sheet.fileName()).build().toString())
                .body(sheet.content());
    }

    /** 寫檔到 app.sheet.output-dir；不帶 workoutId = 全部 */
    @PostMapping("/sheets/render")
    public Map<String, List<String>> renderAll(@RequestParam(required = false) Long workoutId) {
        List<String> written = svc.renderAll(workoutId).stream().map(Path::toString).toList();
        return Map.of("written", written);
    }
}
