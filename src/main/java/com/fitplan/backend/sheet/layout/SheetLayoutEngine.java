package com.fitplan.backend.sheet.layout;

import java.util.Collection;
import java.util.List;

/**
 * pairing → sequencing → page flow 串起來。純運算、不碰 I/O。
 */
public class SheetLayoutEngine {

    private final PageFlowController pageFlow;

    public SheetLayoutEngine(PageFlowController pageFlow) {
        this.pageFlow = pageFlow;
    }

    public SheetLayout layout(String title,
                              List<Long> exerciseIds,
                              Collection<? extends List<Long>> pairedSets,
                              ExerciseLookup lookup) {
        AdjacencyMap adjacency = PairingResolver.resolve(pairedSets);
        List<Block> blocks = EntrySequencer.sequence(exerciseIds, adjacency);
        return pageFlow.layout(title, blocks, lookup);
    }

    public SheetGeometry geometry() {
        return pageFlow.geometry();
    }
}
