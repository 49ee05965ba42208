package com.fitplan.backend.sheet.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageBreakPolicyTest {

    private static final SheetGeometry G = new SheetGeometry(200, 0, 10, 20, 30, 25, 10, 10, 40);

    @Test
    void no_break_when_remaining_space_equals_the_limit() {
        // 80 - 30 = 50 = bottom 10 + threshold 40
        assertFalse(PageBreakPolicy.needsBreak(80, 30, G));
    }

    @Test
    void break_when_remaining_space_is_below_the_limit() {
        assertTrue(PageBreakPolicy.needsBreak(79.5, 30, G));
    }

    @Test
    void bottom_margin_counts_towards_the_limit() {
        SheetGeometry noMargin = new SheetGeometry(200, 0, 0, 20, 30, 25, 10, 10, 40);

        assertFalse(PageBreakPolicy.needsBreak(75, 30, noMargin));
        assertTrue(PageBreakPolicy.needsBreak(75, 30, G));
    }
}
