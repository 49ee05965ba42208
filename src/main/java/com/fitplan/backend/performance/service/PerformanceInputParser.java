package com.fitplan.backend.performance.service;

import java.util.ArrayList;
import java.util.List;

/**
 * 逗號分隔輸入："10, 8,6" → [10, 8, 6]；空白 token 忽略。
 */
public final class PerformanceInputParser {
    private PerformanceInputParser() {}

    public static List<Integer> parseInts(String text) {
        List<Integer> out = new ArrayList<>();
        for (String t : tokens(text)) {
            try {
                out.add(Integer.parseInt(t));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("INVALID_NUMBER_LIST", e);
            }
        }
        return out;
    }

    /** 小數點只認 "."；"62,5" 會被當成兩個 token */
    public static List<Double> parseDoubles(String text) {
        List<Double> out = new ArrayList<>();
        for (String t : tokens(text)) {
            try {
                out.add(Double.parseDouble(t));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("INVALID_NUMBER_LIST", e);
            }
        }
        return out;
    }

    private static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        for (String t : text.split(",")) {
            String s = t.strip();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
