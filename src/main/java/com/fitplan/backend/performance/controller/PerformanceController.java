package com.fitplan.backend.performance.controller;

import com.fitplan.backend.performance.dto.PerformanceEntryDto;
import com.fitplan.backend.performance.dto.RecordPerformanceRequest;
import com.fitplan.backend.performance.dto.RecordPerformanceResponse;
import com.fitplan.backend.performance.service.PerformanceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/performance")
public class PerformanceController {

    private final PerformanceService svc;

    public PerformanceController(PerformanceService svc) {
        this.svc = svc;
    }

    /** 寫入一次訓練的表現（每個動作一筆） */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RecordPerformanceResponse record(
            @Valid @RequestBody RecordPerformanceRequest req,
            @RequestHeader(value = "X-Client-Timezone", required = false) String tz
    ) {
        return svc.record(req, svc.parseZoneOrUtc(tz));
    }

    @GetMapping
    public List<PerformanceEntryDto> list(
            @RequestParam(required = false) Long workoutId,
            @RequestParam(required = false) Long exerciseId
    ) {
        return svc.list(workoutId, exerciseId);
    }
}
