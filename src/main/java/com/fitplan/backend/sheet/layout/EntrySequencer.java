package com.fitplan.backend.sheet.layout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 依 workout 順序走一次動作清單，產生 {@link Block} 序列。
 * <p>
 * 只展開一層夥伴：夥伴自己的夥伴不會被拉進同一個 block，
 * 之後若遇到尚未印出的動作，就自己開新 block。
 * 結果保證是動作清單的 partition（每個 id 只出現一次）。
 */
public final class EntrySequencer {

    private EntrySequencer() {}

    public static List<Block> sequence(List<Long> exerciseIds, AdjacencyMap adjacency) {
        if (exerciseIds == null || exerciseIds.isEmpty()) return List.of();
        AdjacencyMap pairs = (adjacency == null) ? AdjacencyMap.empty() : adjacency;

        Set<Long> inWorkout = new LinkedHashSet<>(exerciseIds);
        Set<Long> rendered = new HashSet<>();
        List<Block> blocks = new ArrayList<>();

        for (Long id : exerciseIds) {
            if (id == null || rendered.contains(id)) continue;
            rendered.add(id);

            List<Long> partners = new ArrayList<>();
            for (Long partner : pairs.partnersOf(id)) {
                if (!inWorkout.contains(partner)) continue;
                if (!rendered.add(partner)) continue;
                partners.add(partner);
            }
            blocks.add(new Block(id, partners));
        }
        return List.copyOf(blocks);
    }
}
