package com.fitplan.backend.sheet.layout;

/**
 * 表單版面常數（單位：PDF point，與 renderer 一致）。
 * y 軸往上為正：cursor 從頁頂往下扣。
 */
public record SheetGeometry(
        double pageHeight,
        double topMargin,
        double bottomMargin,
        double headerHeight,
        double primaryRowHeight,
        double partnerRowHeight,
        double pairedBlockGap,
        double singleBlockGap,
        double breakThreshold
) {
    public static final double POINTS_PER_MM = 72.0 / 25.4;

    public SheetGeometry {
        require(pageHeight > 0, "pageHeight must be > 0");
        require(primaryRowHeight > 0, "primaryRowHeight must be > 0");
        require(partnerRowHeight > 0, "partnerRowHeight must be > 0");
        require(topMargin >= 0 && bottomMargin >= 0, "margins must be >= 0");
        require(headerHeight >= 0, "headerHeight must be >= 0");
        require(pairedBlockGap >= 0 && singleBlockGap >= 0, "gaps must be >= 0");
        require(breakThreshold >= 0, "breakThreshold must be >= 0");

        // 新頁面至少要放得下一列，否則會無限換頁
        double firstCursor = pageHeight - topMargin - headerHeight;
        double tallestRow = Math.max(primaryRowHeight, partnerRowHeight);
        require(firstCursor - tallestRow >= bottomMargin + breakThreshold,
                "a fresh page cannot hold a single row");
    }

    public static double mm(double millimetres) {
        return millimetres * POINTS_PER_MM;
    }

    /** 頁首 baseline 的 y */
    public double pageTop() {
        return pageHeight - topMargin;
    }

    /** 每頁第一列的 cursor */
    public double firstRowY() {
        return pageTop() - headerHeight;
    }

    public double rowHeight(EntryRole role) {
        return role == EntryRole.PARTNER ? partnerRowHeight : primaryRowHeight;
    }

    public double gapAfter(Block block) {
        return block.hasPartners() ? pairedBlockGap : singleBlockGap;
    }

    private static void require(boolean ok, String msg) {
        if (!ok) throw new IllegalArgumentException("INVALID_SHEET_GEOMETRY: " + msg);
    }
}
