package com.fitplan.backend.common;

import java.util.regex.Pattern;

/**
 * 輸出檔名（PDF / PNG）共用的清理規則。
 */
public final class FileNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_\\-]+");

    private FileNames() {}

    /** "Upper / Lower #1" → "Upper_Lower_1"；null → "" */
    public static String sanitize(String s) {
        if (s == null) return "";
        String out = UNSAFE.matcher(s).replaceAll("_");
        int from = 0, to = out.length();
        while (from < to && out.charAt(from) == '_') from++;
        while (to > from && out.charAt(to - 1) == '_') to--;
        return out.substring(from, to);
    }
}
