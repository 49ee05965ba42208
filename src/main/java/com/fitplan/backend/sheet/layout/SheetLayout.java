package com.fitplan.backend.sheet.layout;

import java.util.List;

/**
 * 排版結果：每頁一個 header + 依序排好的 placements（不可變）。
 */
public record SheetLayout(String title, List<PageHeader> headers, List<Placement> placements) {

    public SheetLayout {
        headers = List.copyOf(headers);
        placements = List.copyOf(placements);
    }

    public int pageCount() {
        return headers.size();
    }

    public List<Placement> placementsOn(int pageIndex) {
        return placements.stream().filter(p -> p.pageIndex() == pageIndex).toList();
    }
}
