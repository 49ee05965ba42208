package com.fitplan.backend.sheet.layout;

/** entry 綁定到某頁的某個 y，renderer 直接照畫 */
public record Placement(SheetEntry entry, int pageIndex, double y) {}
