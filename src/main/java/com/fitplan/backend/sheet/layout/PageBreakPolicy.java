package com.fitplan.backend.sheet.layout;

/**
 * 換頁判斷：畫之前檢查，所以一列不會被切成兩頁。
 */
public final class PageBreakPolicy {

    private PageBreakPolicy() {}

    public static boolean needsBreak(double cursor, double entryHeight, SheetGeometry geometry) {
        return cursor - entryHeight < geometry.bottomMargin() + geometry.breakThreshold();
    }
}
