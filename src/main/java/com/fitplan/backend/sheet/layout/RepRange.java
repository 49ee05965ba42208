package com.fitplan.backend.sheet.layout;

import java.util.List;

/**
 * 目標次數：8-12 / 8+（力竭）/ 10。
 * YAML 裡用 -99 代表「做到力竭」。
 */
public record RepRange(int min, Integer max) {

    public static final int TO_FAILURE = -99;

    public static RepRange of(int min, int max) {
        return new RepRange(min, max);
    }

    /** [min] / [min, max]；空或 null → null */
    public static RepRange fromList(List<Integer> values) {
        if (values == null || values.isEmpty() || values.get(0) == null) return null;
        Integer max = values.size() > 1 ? values.get(1) : null;
        return new RepRange(values.get(0), max);
    }

    public boolean isToFailure() {
        return max != null && max == TO_FAILURE;
    }

    /** "8-12" / "8+" / "10" */
    public String display() {
        if (isToFailure()) return min + "+";
        if (max == null) return String.valueOf(min);
        return min + "-" + max;
    }

    @Override
    public String toString() {
        return display();
    }
}
