package com.fitplan.backend.sheet.layout;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public final class SheetEntryFactory {

    private SheetEntryFactory() {}

    public static List<SheetEntry> entriesOf(Block block, ExerciseLookup lookup) {
        List<SheetEntry> out = new ArrayList<>(1 + block.partnerIds().size());
        out.add(entryOf(block.primaryId(), EntryRole.PRIMARY, lookup));
        for (Long partnerId : block.partnerIds()) {
            out.add(entryOf(partnerId, EntryRole.PARTNER, lookup));
        }
        return out;
    }

    public static SheetEntry entryOf(long exerciseId, EntryRole role, ExerciseLookup lookup) {
        ExerciseSpec spec = (lookup == null) ? null : lookup.find(exerciseId).orElse(null);
        if (spec == null) {
            log.debug("exercise {} not in catalog, using placeholder", exerciseId);
            return placeholder(exerciseId, role);
        }
        return new SheetEntry(
                exerciseId,
                spec.displayName(),
                spec.effectiveSets(),
                spec.reps() == null ? null : spec.reps().display(),
                spec.comment(),
                spec.restSeconds(),
                role,
                false
        );
    }

    /** 目錄查不到 → 照樣印一列，避免整張表失敗 */
    public static SheetEntry placeholder(long exerciseId, EntryRole role) {
        return new SheetEntry(
                exerciseId,
                "Exercise #" + exerciseId + " (missing)",
                ExerciseSpec.DEFAULT_SETS,
                null,
                null,
                null,
                role,
                true
        );
    }
}
