package com.fitplan.backend.progress.dto;

import java.time.LocalDate;

/** 某天的平均次數 / 平均重量；該天沒有有效資料的欄位為 null */
public record ProgressPoint(LocalDate date, Double avgReps, Double avgWeight) {}
