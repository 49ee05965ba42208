package com.fitplan.backend.sheet.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * 依版面高度把 block 序列分頁。
 * <p>
 * - 每列畫之前先問 {@link PageBreakPolicy}，不夠就換頁並重畫 header
 * - 畫完扣掉該列高度（primary / partner 列高不同）
 * - block 結束再扣 gap：有夥伴的用 pairedBlockGap，否則 singleBlockGap
 * <p>
 * 本身無狀態；每次 layout 自己建 PageState，可多執行緒共用。
 */
public class PageFlowController {

    private final SheetGeometry geometry;

    public PageFlowController(SheetGeometry geometry) {
        this.geometry = geometry;
    }

    public SheetGeometry geometry() {
        return geometry;
    }

    public SheetLayout layout(String title, List<Block> blocks, ExerciseLookup lookup) {
        List<PageHeader> headers = new ArrayList<>();
        List<Placement> placements = new ArrayList<>();

        PageState page = new PageState(0, geometry.firstRowY());
        headers.add(new PageHeader(page.index, title, geometry.pageTop()));

        for (Block block : blocks) {
            for (SheetEntry entry : SheetEntryFactory.entriesOf(block, lookup)) {
                double height = geometry.rowHeight(entry.role());
                if (PageBreakPolicy.needsBreak(page.cursor, height, geometry)) {
                    page = new PageState(page.index + 1, geometry.firstRowY());
                    headers.add(new PageHeader(page.index, title, geometry.pageTop()));
                }
                placements.add(new Placement(entry, page.index, page.cursor));
                page.cursor -= height;
            }
            page.cursor -= geometry.gapAfter(block);
        }
        return new SheetLayout(title, headers, placements);
    }

    private static final class PageState {
        final int index;
        double cursor;

        PageState(int index, double cursor) {
            this.index = index;
            this.cursor = cursor;
        }
    }
}
