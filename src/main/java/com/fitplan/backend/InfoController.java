package com.fitplan.backend;

import com.fitplan.backend.catalog.dto.CatalogStats;
import com.fitplan.backend.catalog.service.CatalogService;
import org.springframework.web.bind.annotation.*;
import java.time.OffsetDateTime;

/** 健康檢查 + 目錄是否已匯入（exercises / workouts 都是 0 → 還沒 reload） */
@RestController
@RequestMapping("/api")
public class InfoController {

    public record Info(String message, String serverTime, long exercises, long workouts) {}

    private final CatalogService catalog;

    public InfoController(CatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/info")
    public Info info() {
        CatalogStats stats = catalog.stats();
        String message = stats.workouts() == 0
                ? "FitPlan backend is up, catalog is empty"
                : "FitPlan backend is up";
        return new Info(message, OffsetDateTime.now().toString(), stats.exercises(), stats.workouts());
    }
}
