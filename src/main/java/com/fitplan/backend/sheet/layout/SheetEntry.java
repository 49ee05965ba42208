package com.fitplan.backend.sheet.layout;

/**
 * 一個動作在表單上的一列。partner 列資料跟 primary 一樣，只是 renderer 可以縮排。
 */
public record SheetEntry(
        long exerciseId,
        String name,
        int sets,
        String repsText,     // nullable
        String comment,      // nullable
        Integer restSeconds, // nullable
        EntryRole role,
        boolean missing
) {
    public boolean isPartner() {
        return role == EntryRole.PARTNER;
    }
}
